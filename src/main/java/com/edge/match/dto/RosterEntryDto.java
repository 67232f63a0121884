package com.edge.match.dto;

import com.edge.match.core.filter.RosterEntry;
import com.edge.match.model.TeamId;
import lombok.Data;

@Data
public class RosterEntryDto {
    private int jerseyNumber;
    private TeamId team = TeamId.UNKNOWN;

    public RosterEntry toEntry() {
        return new RosterEntry(jerseyNumber, team);
    }
}
