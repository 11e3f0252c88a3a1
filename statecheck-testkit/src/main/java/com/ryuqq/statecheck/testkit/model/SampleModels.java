package com.ryuqq.statecheck.testkit.model;

import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spec.Action;
import com.ryuqq.statecheck.core.spec.Constraint;
import com.ryuqq.statecheck.core.spec.FairnessSpec;
import com.ryuqq.statecheck.core.spec.Invariant;
import com.ryuqq.statecheck.core.spec.Model;
import com.ryuqq.statecheck.core.spec.Successor;
import com.ryuqq.statecheck.core.spec.TemporalProperty;

import java.util.List;

/**
 * Small models with known verdicts, shared by checker tests.
 *
 * <ul>
 *   <li>{@link #transfer}: two accounts moving 30 between each other (3 states)</li>
 *   <li>{@link #mutex}: two processes competing for a critical section (9 states with the weakened guard)</li>
 *   <li>{@link #countdown}: a counter decreasing to 0, optionally idling on the way</li>
 *   <li>{@link #idleReady}: idle/ready cycle where idle may stutter</li>
 *   <li>{@link #boundedCounter}: an unbounded counter cut off by a constraint</li>
 * </ul>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public final class SampleModels {

    public static final String IDLE = "idle";
    public static final String READY = "ready";

    private SampleModels() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Process locations in the mutex model.
     */
    public enum Location { IDLE, WAITING, CRITICAL }

    /**
     * Accounts {@code a=50, b=50}; {@code TransferAB} and {@code TransferBA} move 30 when the
     * source holds at least 30.
     *
     * @param invariant invariant to check
     * @return model
     */
    public static Model transfer(Invariant invariant) {
        return Model.builder()
            .initialState(State.of("a", 50, "b", 50))
            .action(transferAction("TransferAB", "a", "b"))
            .action(transferAction("TransferBA", "b", "a"))
            .invariant(invariant)
            .build();
    }

    public static Invariant sumIs(long total) {
        return Invariant.of("SumIs" + total, s -> s.getLong("a") + s.getLong("b") == total);
    }

    private static Action transferAction(String name, String from, String to) {
        return Action.guarded(name,
            s -> s.getLong(from) >= 30,
            s -> s.with(from, s.getLong(from) - 30).with(to, s.getLong(to) + 30));
    }

    /**
     * Two processes {@code p1, p2} cycling IDLE, WAITING, CRITICAL.
     *
     * @param weakenedGuard if true, Enter ignores the other process
     * @param properties temporal properties to attach
     * @return model with invariant {@code MutualExclusion}
     */
    public static Model mutex(boolean weakenedGuard, TemporalProperty... properties) {
        Model.Builder builder = Model.builder()
            .initialState(State.of("p1", Location.IDLE, "p2", Location.IDLE))
            .invariant(Invariant.of("MutualExclusion",
                s -> !(at(s, "p1", Location.CRITICAL) && at(s, "p2", Location.CRITICAL))));
        for (String self : new String[] {"p1", "p2"}) {
            String other = self.equals("p1") ? "p2" : "p1";
            String suffix = self.substring(1);
            builder.action(Action.guarded("Request" + suffix,
                s -> at(s, self, Location.IDLE), s -> s.with(self, Location.WAITING)));
            builder.action(Action.guarded("Enter" + suffix,
                s -> at(s, self, Location.WAITING) && (weakenedGuard || !at(s, other, Location.CRITICAL)),
                s -> s.with(self, Location.CRITICAL)));
            builder.action(Action.guarded("Exit" + suffix,
                s -> at(s, self, Location.CRITICAL), s -> s.with(self, Location.IDLE)));
        }
        for (TemporalProperty property : properties) {
            builder.property(property);
        }
        return builder.build();
    }

    public static boolean at(State state, String process, Location location) {
        return state.getEnum(process, Location.class) == location;
    }

    /**
     * Counter starting at {@code from}, {@code Decrement} while positive.
     *
     * @param from start value
     * @param idle if true, an {@code Idle} action may stutter on every positive value
     * @param properties temporal properties to attach
     * @return model (deadlocks at 0)
     */
    public static Model countdown(int from, boolean idle, TemporalProperty... properties) {
        Model.Builder builder = Model.builder()
            .initialState(State.of("counter", from))
            .action(Action.guarded("Decrement", s -> s.getLong("counter") > 0,
                s -> s.with("counter", s.getLong("counter") - 1)));
        if (idle) {
            builder.action(Action.guarded("Idle", s -> s.getLong("counter") > 0, s -> s));
        }
        for (TemporalProperty property : properties) {
            builder.property(property);
        }
        return builder.build();
    }

    public static TemporalProperty reachesZero() {
        return TemporalProperty.eventually("ReachesZero", s -> s.getLong("counter") == 0);
    }

    /**
     * {@code Prepare: idle -> ready}, {@code Stutter: idle -> idle}, {@code Reset: ready -> idle},
     * checked against {@code ALWAYS_EVENTUALLY phase = ready}.
     *
     * @param weaklyFairPrepare whether the property assumes {@code WF(Prepare)}
     * @return model
     */
    public static Model idleReady(boolean weaklyFairPrepare) {
        TemporalProperty eventuallyReady = TemporalProperty.alwaysEventually("EventuallyReady",
            s -> READY.equals(s.getString("phase")));
        if (weaklyFairPrepare) {
            eventuallyReady = eventuallyReady.withFairness(FairnessSpec.weak("Prepare"));
        }
        return Model.builder()
            .initialState(State.of("phase", IDLE))
            .action(Action.guarded("Prepare", s -> IDLE.equals(s.getString("phase")), s -> s.with("phase", READY)))
            .action(Action.guarded("Stutter", s -> IDLE.equals(s.getString("phase")), s -> s))
            .action(Action.guarded("Reset", s -> READY.equals(s.getString("phase")), s -> s.with("phase", IDLE)))
            .property(eventuallyReady)
            .build();
    }

    /**
     * Counter {@code n} incremented forever, with constraint {@code n <= limit}.
     *
     * @param limit last expanded value
     * @return model with {@code limit + 2} reachable states
     */
    public static Model boundedCounter(int limit) {
        return Model.builder()
            .initialState(State.of("n", 0))
            .action(Action.of("Inc", s -> List.of(Successor.of("Inc", s.with("n", s.getLong("n") + 1)))))
            .constraint(Constraint.of("Bound", s -> s.getLong("n") <= limit))
            .build();
    }
}
