package org.teamelites.swarm.reasoning;

/**
 * Cross-agent reasoning gathered for one message.
 *
 * @param xml           {@code <swarm-context>} block to prepend to the message, empty when there is none.
 * @param thoughtCount  number of thoughts from other agents included.
 * @param decisionCount number of shared decisions included.
 */
public record ReasoningContext(String xml, int thoughtCount, int decisionCount) {

    /** No context available. */
    public static final ReasoningContext EMPTY = new ReasoningContext("", 0, 0);

    public ReasoningContext {
        if (xml == null) {
            xml = "";
        }
    }

    public boolean isEmpty() {
        return xml.isEmpty();
    }
}
