package com.bbthechange.activityfeed.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live view of a principal as reported by the principal service. Never cached across evaluations.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PrincipalProfile {
    private String principalId;
    private String tenantAlias;
    private Visibility visibility;
    private EmailPreference emailPreference;
    private String timezone;
}
