package io.jerry.core.agent;

enum CycleState {
    START,
    ASSEMBLING,
    DECIDING,
    DISPATCHING,
    FOLDING,
    DONE,
    TERMINATED
}
