package com.questrail.central.runtime;

import com.questrail.central.api.CentralController;
import com.questrail.central.api.CentralEventListener;
import com.questrail.central.api.ReadinessState;
import com.questrail.central.config.CentralRuntimeConfig;
import com.questrail.central.internal.CentralContext;
import com.questrail.central.internal.dispatch.CentralEventDispatcher;
import com.questrail.central.internal.gate.ReadinessGate;
import com.questrail.central.internal.peripheral.ConnectCoordinator;
import com.questrail.central.internal.peripheral.DisconnectCoordinator;
import com.questrail.central.internal.scan.ScanCoordinator;
import com.questrail.central.internal.time.HashedWheelTimerScheduler;
import com.questrail.central.internal.time.MonotonicClock;
import com.questrail.central.internal.time.MonotonicScheduler;
import com.questrail.central.internal.time.ScheduledExecutorScheduler;
import com.questrail.central.internal.time.SystemMonotonicClock;
import com.questrail.central.internal.time.SystemWallClock;
import com.questrail.central.observability.CentralObservabilitySink;
import com.questrail.central.observability.NullObservabilitySink;
import com.questrail.central.radio.RadioManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * CentralProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the central coordination stack.
 *
 * <pre>
 *   RadioManager ──notifications──▶ EventLoopRadioListener ─┐
 *                                                           ▼
 *   callers ──▶ CentralController ──▶ CentralOperationalDriver (one thread)
 *                                       │  ReadinessGate
 *                                       │  ScanCoordinator
 *                                       │  Connect/DisconnectCoordinator
 *                                       │  CentralEventDispatcher
 *   scheduler ──deadline firings────────┘
 * </pre>
 */
public final class CentralProductionRuntime {
    private final RadioManager radio;
    private final CentralOperationalDriver driver;
    private final CentralEventDispatcher dispatcher;
    private final CentralController controller;
    private final Runnable schedulerShutdown;

    private CentralProductionRuntime(
            RadioManager radio,
            CentralOperationalDriver driver,
            CentralEventDispatcher dispatcher,
            CentralController controller,
            Runnable schedulerShutdown) {
        this.radio = radio;
        this.driver = driver;
        this.dispatcher = dispatcher;
        this.controller = controller;
        this.schedulerShutdown = schedulerShutdown;
    }

    /**
     * Starts the event loop and subscribes to radio notifications.
     */
    public void start() {
        driver.start();
        radio.setListener(new EventLoopRadioListener(driver, dispatcher));
    }

    /**
     * Stops the event loop and the deadline scheduler. Callbacks of requests
     * still pending are not invoked.
     */
    public void stop() {
        driver.stop();
        schedulerShutdown.run();
    }

    public CentralController controller() {
        return controller;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private RadioManager radio;
        private CentralRuntimeConfig config = CentralRuntimeConfig.defaults();
        private CentralObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ReadinessState initialState = ReadinessState.UNKNOWN;
        private final List<CentralEventListener> eventListeners = new ArrayList<>();
        private long timerWheelTickMillis = 0L;

        public Builder withRadioManager(RadioManager radio) {
            this.radio = radio;
            return this;
        }

        public Builder withConfig(CentralRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(CentralObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Readiness assumed until the radio manager reports its first state.
         */
        public Builder withInitialState(ReadinessState state) {
            this.initialState = state;
            return this;
        }

        public Builder withEventListener(CentralEventListener listener) {
            this.eventListeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Arms deadlines on a Netty timer wheel instead of a scheduled executor.
         */
        public Builder withTimerWheel(long tickMillis) {
            if (tickMillis <= 0) {
                throw new IllegalArgumentException("tickMillis must be > 0");
            }
            this.timerWheelTickMillis = tickMillis;
            return this;
        }

        public CentralProductionRuntime build() {
            Objects.requireNonNull(radio, "radio");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(initialState, "initialState");
            CentralObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Time
            MonotonicClock clock = SystemMonotonicClock.INSTANCE;
            MonotonicScheduler scheduler;
            Runnable schedulerShutdown;
            if (timerWheelTickMillis > 0) {
                HashedWheelTimerScheduler wheel = new HashedWheelTimerScheduler(timerWheelTickMillis, clock);
                scheduler = wheel;
                schedulerShutdown = wheel::stop;
            } else {
                ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
                    Thread t = new Thread(runnable, "central-deadlines");
                    t.setDaemon(true);
                    return t;
                });
                scheduler = new ScheduledExecutorScheduler(executor, clock);
                // Pending deadlines are moot once the event loop is gone.
                schedulerShutdown = executor::shutdownNow;
            }

            // 2. Event loop (single owner of coordinator state)
            CentralOperationalDriver driver = new CentralOperationalDriver(sink);
            CentralContext context = new CentralContext(radio, clock, scheduler, driver, SystemWallClock.INSTANCE, sink);

            // 3. Gate and coordinators
            ReadinessGate gate = new ReadinessGate(context, initialState);
            ScanCoordinator scans = new ScanCoordinator(context, gate);
            ConnectCoordinator connects = new ConnectCoordinator(context, gate);
            DisconnectCoordinator disconnects = new DisconnectCoordinator(context, gate);

            // 4. Dispatcher
            CentralEventDispatcher dispatcher = new CentralEventDispatcher(
                context, gate, scans, connects, disconnects, config.pendingRequestPolicy());
            eventListeners.forEach(dispatcher::addListener);

            CentralController controller = new EventLoopCentralController(
                driver, gate, scans, connects, disconnects, dispatcher, config.timingPolicy());

            return new CentralProductionRuntime(radio, driver, dispatcher, controller, schedulerShutdown);
        }
    }
}
