package com.fulqrom.backend.modules.access.application;

import java.util.List;

/**
 * Resources of one type a user may view. With module access every id is in scope except those a grant
 * explicitly withholds; without it only ids granted view are.
 */
public record AccessScope(
        String userId,
        String resourceType,
        String moduleName,
        boolean fullAccess,
        List<String> resourceIds,
        List<String> excludedResourceIds
) {

    public AccessScope {
        resourceIds = List.copyOf(resourceIds);
        excludedResourceIds = List.copyOf(excludedResourceIds);
    }

    public boolean covers(String resourceId) {
        return fullAccess ? !excludedResourceIds.contains(resourceId) : resourceIds.contains(resourceId);
    }
}
