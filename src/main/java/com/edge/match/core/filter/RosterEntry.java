package com.edge.match.core.filter;

import com.edge.match.model.TeamId;

public class RosterEntry {
    private final int jerseyNumber;
    private final TeamId teamId;

    public RosterEntry(int jerseyNumber, TeamId teamId) {
        this.jerseyNumber = jerseyNumber;
        this.teamId = teamId;
    }

    public int getJerseyNumber() { return jerseyNumber; }
    public TeamId getTeamId() { return teamId; }
}
