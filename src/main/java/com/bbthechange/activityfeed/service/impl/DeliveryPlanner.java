package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityRegistry;
import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.DeliverySet;
import com.bbthechange.activityfeed.model.StreamRoute;
import com.bbthechange.activityfeed.service.RecipientResolver;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Expands an activity's stream routes into candidate recipients.
 *
 * Routes are resolved for every member of the activity, not only the latest event's entities,
 * so everyone who saw an earlier revision also receives its replacement.
 */
@Component
public class DeliveryPlanner {

    private final ActivityRegistry registry;
    private final RecipientResolver recipientResolver;

    public DeliveryPlanner(ActivityRegistry registry, RecipientResolver recipientResolver) {
        this.registry = registry;
        this.recipientResolver = recipientResolver;
    }

    public DeliverySet plan(Activity activity) {
        DeliverySet deliverySet = new DeliverySet();
        for (StreamRoute route : registry.require(activity.getVerb()).routes()) {
            for (String principalId : activity.idsFor(route.entity())) {
                for (String recipientId : resolve(route.association(), principalId)) {
                    if (route.excludeActors() && activity.getActorIds().contains(recipientId)) {
                        continue;
                    }
                    if (route.association() == StreamRoute.Association.FOLLOWERS) {
                        deliverySet.addFollower(route.stream(), recipientId, principalId);
                    } else {
                        deliverySet.add(route.stream(), recipientId);
                    }
                }
            }
        }
        return deliverySet;
    }

    private Set<String> resolve(StreamRoute.Association association, String principalId) {
        return switch (association) {
            case SELF -> Set.of(principalId);
            case FOLLOWERS -> recipientResolver.followersOf(principalId);
            case MEMBERS -> recipientResolver.membersOf(principalId);
        };
    }
}
