package com.example.realty.service.brain;

import com.example.realty.dto.PropertySummary;
import com.example.realty.service.extraction.PartialSlots;

import java.util.List;

/**
 * Everything gathered from collaborators before a transition, so the transition itself stays free of I/O.
 *
 * @param answer        free-form answer from the inference service, null when not asked or unavailable
 * @param scarcityUnits "only N units left" figure, drawn outside the transition
 */
public record TurnFacts(Triage triage,
                        PartialSlots extracted,
                        String answer,
                        List<PropertySummary> matches,
                        int scarcityUnits,
                        String agentName) {

    public TurnFacts {
        extracted = extracted == null ? PartialSlots.empty() : extracted;
        matches = matches == null ? List.of() : List.copyOf(matches);
        triage = triage == null ? Triage.of(InputKind.UNRECOGNIZED) : triage;
    }

    public static TurnFacts none(String agentName) {
        return new TurnFacts(Triage.of(InputKind.UNRECOGNIZED), PartialSlots.empty(), null, List.of(), 0, agentName);
    }

    public boolean hasAnswer() {
        return answer != null && !answer.isBlank();
    }
}
