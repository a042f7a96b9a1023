package com.sync.pipeline.link;

/**
 * Relationship type names.
 */
public final class RelationshipTypes {

    /** identity to group */
    public static final String MEMBER_OF = "member_of";
    /** identity to role */
    public static final String ASSIGNED_ROLE = "assigned_role";
    /** license to identity */
    public static final String HAS_LICENSE = "has_license";
    /** policy to identity or group */
    public static final String APPLIES_TO = "applies_to";

    private RelationshipTypes() {
    }
}
