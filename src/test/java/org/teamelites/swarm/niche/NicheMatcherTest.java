package org.teamelites.swarm.niche;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.teamelites.swarm.api.Domain;
import org.teamelites.swarm.api.InboundMessage;
import org.teamelites.swarm.api.NicheDescriptor;

@Tag("unit")
class NicheMatcherTest {

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource({
            "Please fix the bug in my python function, CODING",
            "Schedule a meeting with the team tomorrow, SCHEDULING",
            "Draft an email to the newsletter subscribers, COMMUNICATION",
            "Investigate the literature on this hypothesis, RESEARCH",
            "SCHEDULE A MEETING, SCHEDULING",
            "hello there, GENERAL"
    })
    void classifiesByKeywordHits(String text, Domain expected) {
        assertThat(NicheMatcher.classifyDomain(text)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Empty or missing text is general")
    void emptyTextIsGeneral() {
        assertThat(NicheMatcher.classifyDomain("")).isEqualTo(Domain.GENERAL);
        assertThat(NicheMatcher.classifyDomain(null)).isEqualTo(Domain.GENERAL);
    }

    @Test
    @DisplayName("Ties go to the domain declared first")
    void tieGoesToEarlierDomain() {
        // one coding hit ("code") against one scheduling hit ("meeting")
        assertThat(NicheMatcher.classifyDomain("code meeting")).isEqualTo(Domain.CODING);
    }

    @Test
    void matchNicheCombinesChannelAndDomain() {
        NicheDescriptor niche = NicheMatcher.matchNiche(InboundMessage.of("telegram", "c1", "u1", "fix this bug"));

        assertThat(niche.channel()).isEqualTo("telegram");
        assertThat(niche.domain()).isEqualTo(Domain.CODING);
        assertThat(niche.key()).isEqualTo("telegram-coding");
    }

    @Test
    void generalHasNoKeywords() {
        assertThat(NicheMatcher.keywordsFor(Domain.GENERAL)).isEmpty();
        assertThat(NicheMatcher.keywordsFor(Domain.RESEARCH)).contains("hypothesis", "dataset");
    }
}
