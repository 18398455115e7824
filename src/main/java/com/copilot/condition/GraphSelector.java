package com.copilot.condition;

/**
 * Graph references of a condition node. Which fields are used depends on the condition type:
 * <ul>
 *   <li>CONNECTED: {@code relation}, {@code targetType}, optional {@code direction}</li>
 *   <li>PATH_EXISTS: {@code targetId}, {@code maxHops}</li>
 *   <li>ATTRIBUTE: {@code nodeRef = "subject"}, or a neighbor selector made of
 *       {@code relation}, optional {@code direction} and optional {@code targetType}</li>
 * </ul>
 * Labels are kept as text so that unknown relations and types are reported when the rule is loaded.
 *
 * @param nodeRef    "subject" to select the subject node itself
 * @param relation   Relation label
 * @param direction  OUT, IN or BOTH (OUT when null)
 * @param targetType Node type label
 * @param targetId   Target node id
 * @param maxHops    Path length cutoff
 */
public record GraphSelector(
        String nodeRef,
        String relation,
        String direction,
        String targetType,
        String targetId,
        Integer maxHops
) {
    public static final String SUBJECT = "subject";

    public static GraphSelector subject() {
        return new GraphSelector(SUBJECT, null, null, null, null, null);
    }

    public static GraphSelector neighbors(String relation, String direction, String targetType) {
        return new GraphSelector(null, relation, direction, targetType, null, null);
    }

    public static GraphSelector connected(String relation, String targetType) {
        return new GraphSelector(null, relation, null, targetType, null, null);
    }

    public static GraphSelector path(String targetId, int maxHops) {
        return new GraphSelector(null, null, null, null, targetId, maxHops);
    }

    public boolean isSubject() {
        return SUBJECT.equalsIgnoreCase(nodeRef);
    }
}
