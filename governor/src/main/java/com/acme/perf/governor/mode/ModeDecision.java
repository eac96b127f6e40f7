package com.acme.perf.governor.mode;

public sealed interface ModeDecision<M extends Enum<M>> permits ModeDecision.Hold, ModeDecision.Switch {
    M mode();

    String reason();

    record Hold<M extends Enum<M>>(M mode, String reason) implements ModeDecision<M> {}

    record Switch<M extends Enum<M>>(M from, M to, String reason) implements ModeDecision<M> {
        @Override
        public M mode() {
            return to;
        }
    }
}
