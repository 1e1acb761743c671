package com.keystone.core.model;

import java.io.Serializable;

public record SubgoalProposal(String goal, boolean independent) implements Serializable {

    public SubgoalProposal {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("subgoal must not be blank");
        }
    }
}
