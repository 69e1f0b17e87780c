package com.shlawgathon.sentientloop.backend.exception;

import com.shlawgathon.sentientloop.backend.model.Checkpoint;
import com.shlawgathon.sentientloop.backend.model.CheckpointStatus;
import lombok.Getter;

/**
 * The checkpoint left PENDING before this request's compare-and-swap ran.
 * Carries the checkpoint as it is now so callers can show the real state.
 */
@Getter
public class AlreadyResolvedException extends InvalidTransitionException {

    private final transient Checkpoint current;

    public AlreadyResolvedException(Checkpoint current, CheckpointStatus requested) {
        super(current.getId(), current.getStatus().name(), requested.name(),
                "Checkpoint " + current.getId() + " is already " + current.getStatus());
        this.current = current;
    }
}
