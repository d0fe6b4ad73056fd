package com.wayfarer.crm.api;

import java.util.List;
import java.util.Map;

/**
 * What the caller may do, as shown to the frontend for menu rendering.
 *
 * @param userId principal id
 * @param role principal role
 * @param admin whether the role bypasses the permission matrix
 * @param permissions module to granted actions, modules without grants omitted
 */
public record PermissionSummary(String userId, String role, boolean admin, Map<String, List<String>> permissions) {}
