package tally.core.fault;

import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Converts OS signals delivered while a test runs into a {@link FaultException} raised on the thread running that
 * test, so that a signal which would otherwise end the process is recorded as a single test failure instead.
 *
 * Tests run inside a guarded frame ({@link #runGuarded(GuardedTask)}). A handler that receives a fault marks it
 * pending on the active frame and interrupts the guarded thread. The pending fault is raised on the guarded thread
 * at the next check ({@link #throwIfPending()}), and in any case when the frame closes, where it supersedes whatever
 * else the task did. Only the first fault delivered to a frame counts.
 *
 * Limitations: a task that never reaches a check, a blocking call or its own end cannot be preempted, and some
 * signals cannot be intercepted on any platform. On the JVM, invalid memory access and arithmetic faults already
 * arrive as ordinary throwables ({@link NullPointerException}, {@link ArithmeticException},
 * {@link StackOverflowError}) and never reach this class.
 *
 * This class is thread-safe: handlers run on threads of their own.
 */
public final class FaultTranslator {
    private static final Logger LOGGER = Logger.forClass(FaultTranslator.class);
    private static final FaultTranslator GLOBAL = new FaultTranslator(new NativeSignalRegistrar());
    private final Object monitor = new Object();
    private final SignalRegistrar registrar;
    private final EnumSet<FaultKind> interceptedKinds = EnumSet.noneOf(FaultKind.class);
    private boolean installed = false;
    private Frame activeFrame = null;

    private FaultTranslator(SignalRegistrar registrar) {
        ObjectChecker.assertNonNull(registrar);
        this.registrar = registrar;
    }

    /**
     * Returns the process-wide translator, which intercepts real OS signals once installed.
     */
    public static FaultTranslator global() {
        return GLOBAL;
    }

    /**
     * Returns a new translator that installs its handlers through the given registrar.
     */
    public static FaultTranslator withRegistrar(SignalRegistrar registrar) {
        return new FaultTranslator(registrar);
    }

    /**
     * Installs one handler per {@link FaultKind}. Only the first invocation does anything.
     */
    public void install() {
        synchronized (this.monitor) {
            if (this.installed) {
                return;
            }
            this.installed = true;
        }

        for (FaultKind kind : FaultKind.values()) {
            if (this.registrar.register(kind, this)) {
                synchronized (this.monitor) {
                    this.interceptedKinds.add(kind);
                }
            }
        }
        LOGGER.log("Intercepting faults: " + getInterceptedKinds());
    }

    public boolean isInstalled() {
        synchronized (this.monitor) {
            return this.installed;
        }
    }

    /**
     * Returns the kinds of fault for which a handler was installed.
     */
    public Set<FaultKind> getInterceptedKinds() {
        synchronized (this.monitor) {
            return Collections.unmodifiableSet(EnumSet.copyOf(this.interceptedKinds));
        }
    }

    /**
     * Executes the task inside a guarded frame on the calling thread.
     *
     * If a fault is delivered before the frame closes, a {@link FaultException} for it is thrown once the task has
     * returned or unwound, with anything the task threw attached as suppressed.
     *
     * @param task The task to execute.
     * @throws FaultException If a fault was delivered while the task ran.
     * @throws Exception Whatever the task throws, when no fault was delivered.
     */
    public void runGuarded(GuardedTask task) throws Exception {
        ObjectChecker.assertNonNull(task);
        Frame frame = enterFrame();
        try {
            task.execute();
        } catch (Throwable t) {
            FaultException fault = leaveFrame(frame, t);
            if (fault != null) {
                throw fault;
            }
            throw t;
        }
        FaultException fault = leaveFrame(frame, null);
        if (fault != null) {
            throw fault;
        }
    }

    /**
     * Delivers a fault to the active guarded frame. May be invoked from any thread.
     *
     * @param kind The kind of fault.
     * @return true if a guarded frame was active to receive the fault, false otherwise.
     */
    public boolean deliver(FaultKind kind) {
        ObjectChecker.assertNonNull(kind);
        synchronized (this.monitor) {
            Frame frame = this.activeFrame;
            if (frame == null) {
                return false;
            }
            if (frame.pending == null) {
                frame.pending = kind;
                frame.thread.interrupt();
            }
            return true;
        }
    }

    /**
     * Throws the pending fault if one was delivered to the active frame and the calling thread is the guarded thread.
     *
     * @throws FaultException If a fault is pending.
     */
    public void throwIfPending() {
        FaultKind pending = null;
        synchronized (this.monitor) {
            Frame frame = this.activeFrame;
            if (frame != null && frame.thread == Thread.currentThread()) {
                pending = frame.pending;
            }
        }
        if (pending != null) {
            throw new FaultException(pending);
        }
    }

    /**
     * Returns true if a guarded frame is currently active.
     */
    public boolean isGuarding() {
        synchronized (this.monitor) {
            return this.activeFrame != null;
        }
    }

    private Frame enterFrame() {
        synchronized (this.monitor) {
            this.activeFrame = new Frame(Thread.currentThread(), this.activeFrame);
            return this.activeFrame;
        }
    }

    private FaultException leaveFrame(Frame frame, Throwable thrown) {
        FaultKind pending;
        synchronized (this.monitor) {
            this.activeFrame = frame.previous;
            pending = frame.pending;
        }
        if (pending == null) {
            return null;
        }

        // The interrupt was ours: do not let it leak into whatever runs next on this thread.
        Thread.interrupted();
        LOGGER.log("Fault raised in guarded frame: " + pending.description());

        if (thrown instanceof FaultException && ((FaultException) thrown).getKind() == pending) {
            return (FaultException) thrown;
        }
        FaultException fault = new FaultException(pending);
        if (thrown != null) {
            fault.addSuppressed(thrown);
        }
        return fault;
    }

    @Override
    public String toString() {
        synchronized (this.monitor) {
            return this.getClass().getSimpleName() + " { installed: " + this.installed + ", intercepting: " + this.interceptedKinds + ", guarding: " + (this.activeFrame != null) + " }";
        }
    }

    private static final class Frame {
        private final Thread thread;
        private final Frame previous;
        private FaultKind pending = null;

        private Frame(Thread thread, Frame previous) {
            this.thread = thread;
            this.previous = previous;
        }
    }
}
