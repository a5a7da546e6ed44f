package com.bbthechange.activityfeed.service.impl;

import com.bbthechange.activityfeed.config.ActivityProperties;
import com.bbthechange.activityfeed.config.ActivityRegistry;
import com.bbthechange.activityfeed.exception.ConflictException;
import com.bbthechange.activityfeed.exception.EventValidationException;
import com.bbthechange.activityfeed.model.Activity;
import com.bbthechange.activityfeed.model.AggregateState;
import com.bbthechange.activityfeed.model.AggregateStatus;
import com.bbthechange.activityfeed.model.AggregationOutcome;
import com.bbthechange.activityfeed.model.DeliverySet;
import com.bbthechange.activityfeed.model.GroupKey;
import com.bbthechange.activityfeed.model.GroupingRule;
import com.bbthechange.activityfeed.model.RawEvent;
import com.bbthechange.activityfeed.repository.ActivityRepository;
import com.bbthechange.activityfeed.repository.AggregateStateRepository;
import com.bbthechange.activityfeed.service.ActivityAggregator;
import com.bbthechange.activityfeed.util.ActivityIdGenerator;
import com.bbthechange.activityfeed.util.GroupKeys;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregation state machine.
 *
 * Every grouping rule of the verb sees every event. Exactly one rule's aggregate claims the event
 * and owns the resulting activity; the others still record the membership but end up orphaned,
 * pointing at the aggregate that represents them.
 *
 * Write order per event: new activity, claimer state (the commit point, CAS), non-claimer states,
 * then deletion of the activities that were replaced. A failure before the commit point leaves
 * at most an unreferenced activity behind.
 */
@Service
public class ActivityAggregatorImpl implements ActivityAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ActivityAggregatorImpl.class);

    private static final long INITIAL_RETRY_DELAY_MS = 20;
    private static final double RETRY_BACKOFF_MULTIPLIER = 2.0;

    private final ActivityRegistry registry;
    private final AggregateStateRepository stateRepository;
    private final ActivityRepository activityRepository;
    private final DeliveryPlanner deliveryPlanner;
    private final ActivityIdGenerator idGenerator;
    private final ActivityProperties properties;
    private final MeterRegistry meterRegistry;

    public ActivityAggregatorImpl(ActivityRegistry registry,
                                  AggregateStateRepository stateRepository,
                                  ActivityRepository activityRepository,
                                  DeliveryPlanner deliveryPlanner,
                                  ActivityIdGenerator idGenerator,
                                  ActivityProperties properties,
                                  MeterRegistry meterRegistry) {
        this.registry = registry;
        this.stateRepository = stateRepository;
        this.activityRepository = activityRepository;
        this.deliveryPlanner = deliveryPlanner;
        this.idGenerator = idGenerator;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public AggregationOutcome aggregate(RawEvent event) {
        validate(event);
        List<GroupingRule> rules = registry.rulesFor(event.verb());
        int maxAttempts = properties.getAggregation().getMaxCasAttempts();
        long delayMs = INITIAL_RETRY_DELAY_MS;

        for (int attempt = 1; ; attempt++) {
            try {
                AggregationOutcome outcome = aggregateOnce(event, rules);
                meterRegistry.counter("activity_aggregation_total",
                        "outcome", outcome.isRedundant() ? "redundant" : "materialized").increment();
                return outcome;

            } catch (ConflictException e) {
                if (attempt >= maxAttempts) {
                    logger.warn("Giving up on event {} ({}) after {} conflicting attempts",
                            event.eventId(), event.verb(), attempt);
                    meterRegistry.counter("activity_aggregation_total", "outcome", "conflict").increment();
                    throw e;
                }
                logger.debug("Conflict on aggregate {} for event {}, retrying (attempt {})",
                        e.getGroupKey(), event.eventId(), attempt);
                sleep(delayMs);
                delayMs = (long) (delayMs * RETRY_BACKOFF_MULTIPLIER);
            }
        }
    }

    private AggregationOutcome aggregateOnce(RawEvent event, List<GroupingRule> rules) {
        List<Candidate> candidates = loadCandidates(event, rules);

        Optional<Candidate> containing = candidates.stream()
                .filter(c -> c.stored().getStatus().isActive() && c.stored().contains(event))
                .findFirst();
        if (containing.isPresent()) {
            recordRedundantMembership(event, candidates, containing.get().key().value());
            logger.debug("Event {} already represented by aggregate {}", event.eventId(), containing.get().key());
            return AggregationOutcome.redundant();
        }

        Candidate claimer = pickClaimer(candidates);
        String claimerKey = claimer.key().value();
        List<Subsumption> subsumed = new ArrayList<>();
        List<Activity> shownElsewhere = new ArrayList<>();
        findTakeovers(claimer, candidates, subsumed, shownElsewhere);

        AggregateState claimed = withoutPairsShownBy(claimer, shownElsewhere);
        if (!claimed.hasActorsAndObjects()) {
            String representedBy = shownElsewhere.get(0).getSourceGroupKey();
            recordRedundantMembership(event, candidates, representedBy);
            logger.debug("Event {} already shown by the live activity of aggregate {}", event.eventId(), representedBy);
            return AggregationOutcome.redundant();
        }

        Activity activity = new Activity(
                idGenerator.nextId(),
                event.verb(),
                claimed.getMemberActorIds(),
                claimed.getMemberObjectIds(),
                claimed.getMemberTargetIds(),
                claimed.getLastUpdatedAt(),
                claimerKey,
                (int) (claimer.stored().getVersion() + 1));
        activityRepository.save(activity);

        claimed.setStatus(AggregateStatus.active(activity.getActivityId()));
        try {
            stateRepository.put(claimed);
        } catch (ConflictException e) {
            activityRepository.delete(activity.getActivityId());
            throw e;
        }

        // Claim committed; the remaining writes only retire what it replaces
        List<String> retired = new ArrayList<>();
        String previous = claimer.stored().getLastActivityId();
        if (previous != null) {
            retired.add(previous);
        }
        for (Candidate candidate : candidates) {
            if (candidate != claimer) {
                orphan(candidate, event, claimerKey, retired);
            }
        }
        for (Subsumption subsumption : subsumed) {
            try {
                stateRepository.put(subsumption.orphaned());
                retired.add(subsumption.activityId());
            } catch (ConflictException e) {
                logger.debug("Aggregate {} changed while being subsumed by {}, leaving it",
                        subsumption.orphaned().getGroupKey(), claimerKey);
            }
        }
        retired.forEach(activityRepository::delete);

        DeliverySet deliverySet = deliveryPlanner.plan(activity);
        logger.info("Materialized activity {} (revision {}) for {} via rule {}, replacing {}",
                activity.getActivityId(), activity.getRevision(), event.verb(), claimer.key().ruleId(), retired);
        return new AggregationOutcome(activity, retired, deliverySet);
    }

    private List<Candidate> loadCandidates(RawEvent event, List<GroupingRule> rules) {
        List<Candidate> candidates = new ArrayList<>(rules.size());
        for (int order = 0; order < rules.size(); order++) {
            GroupingRule rule = rules.get(order);
            GroupKey key = GroupKeys.compute(rule, event);
            Instant expiresAt = Instant.ofEpochMilli((key.timeBucket() + 2) * rule.mergeWindow().toMillis());

            AggregateState stored = stateRepository.find(key.value())
                    .orElseGet(() -> new AggregateState(key.value(), rule.ruleId(), rule.verb()));
            AggregateState merged = new AggregateState(stored);
            merged.merge(event);
            merged.setExpiresAt(expiresAt);

            candidates.add(new Candidate(order, rule, key, stored, merged));
        }
        return candidates;
    }

    /**
     * Merging into an existing live activity wins over starting a new one; among fresh
     * aggregates the first rule that actually groups something wins, then plain rule order.
     */
    private Candidate pickClaimer(List<Candidate> candidates) {
        Comparator<Candidate> oldestFirst = Comparator
                .comparing((Candidate c) -> c.stored().getCreatedAt())
                .thenComparingInt(Candidate::order);

        return candidates.stream()
                .filter(c -> c.stored().getStatus().isActive())
                .min(oldestFirst)
                .or(() -> candidates.stream().filter(c -> c.merged().isNonTrivial()).findFirst())
                .orElse(candidates.get(0));
    }

    /**
     * Live aggregates that previously took over the claimer's members. One whose whole content
     * the claimer now covers is subsumed: its activity is retired once the claimer publishes.
     * Any other keeps showing its pairs, collected into {@code shownElsewhere}.
     */
    private void findTakeovers(Candidate claimer, List<Candidate> candidates,
                               List<Subsumption> subsumed, List<Activity> shownElsewhere) {
        Set<String> candidateKeys = candidates.stream()
                .map(c -> c.key().value())
                .collect(Collectors.toSet());

        for (String groupKey : claimer.stored().getStatus().supersededBy()) {
            if (candidateKeys.contains(groupKey)) {
                continue;
            }
            Optional<AggregateState> other = stateRepository.find(groupKey);
            if (other.isEmpty() || !other.get().getStatus().isActive()) {
                continue;
            }
            String activityId = other.get().getLastActivityId();
            Optional<Activity> represented = activityRepository.findById(activityId);
            if (represented.isEmpty()) {
                continue;
            }
            if (claimer.merged().covers(represented.get())) {
                AggregateState orphaned = new AggregateState(other.get());
                orphaned.setStatus(AggregateStatus.orphaned(Set.of(claimer.key().value())));
                subsumed.add(new Subsumption(orphaned, activityId));
            } else {
                shownElsewhere.add(represented.get());
            }
        }
    }

    /**
     * The claimer's merged state minus every (actor, object) pair a live activity in
     * {@code shownElsewhere} already shows. Pairs are removed along the side the live activity
     * fully spans, so the remainder is still a full actors x objects product.
     */
    private static AggregateState withoutPairsShownBy(Candidate claimer, List<Activity> shownElsewhere) {
        AggregateState claimed = new AggregateState(claimer.merged());
        for (Activity live : shownElsewhere) {
            Set<String> actors = claimed.getMemberActorIds();
            Set<String> objects = claimed.getMemberObjectIds();
            if (Collections.disjoint(actors, live.getActorIds()) || Collections.disjoint(objects, live.getObjectIds())) {
                continue;
            }
            if (live.getActorIds().containsAll(actors)) {
                claimed.removeMembers(List.of(), live.getObjectIds());
            } else if (live.getObjectIds().containsAll(objects)) {
                claimed.removeMembers(live.getActorIds(), List.of());
            } else {
                // Neither side nests; drop the shared objects, which may hide a few extra pairs
                claimed.removeMembers(List.of(), live.getObjectIds());
            }
        }
        return claimed;
    }

    /**
     * Record the event in a losing aggregate and point it at the claimer. Retried on its own
     * because the claim is already committed. An aggregate that another writer activated in the
     * meantime is left to its new owner.
     */
    private void orphan(Candidate candidate, RawEvent event, String claimerKey, List<String> retired) {
        int maxAttempts = properties.getAggregation().getMaxCasAttempts();
        AggregateState current = candidate.stored();

        for (int attempt = 1; ; attempt++) {
            AggregateState next = new AggregateState(current);
            next.merge(event);
            next.setExpiresAt(candidate.merged().getExpiresAt());
            next.setStatus(supersededBy(current.getStatus(), claimerKey));
            try {
                stateRepository.put(next);
                String previous = current.getLastActivityId();
                if (previous != null) {
                    retired.add(previous);
                }
                return;
            } catch (ConflictException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                current = stateRepository.find(candidate.key().value())
                        .orElseGet(() -> new AggregateState(candidate.key().value(),
                                candidate.rule().ruleId(), candidate.rule().verb()));
                if (current.getStatus().isActive()) {
                    logger.info("Aggregate {} was activated concurrently, not orphaning it", current.getGroupKey());
                    return;
                }
            }
        }
    }

    private void recordRedundantMembership(RawEvent event, List<Candidate> candidates, String representedBy) {
        for (Candidate candidate : candidates) {
            AggregateState stored = candidate.stored();
            if (stored.getStatus().isActive() || stored.contains(event)) {
                continue;
            }
            AggregateState next = new AggregateState(candidate.merged());
            next.setStatus(supersededBy(stored.getStatus(), representedBy));
            stateRepository.put(next);
        }
    }

    private static AggregateStatus supersededBy(AggregateStatus status, String groupKey) {
        return status.match(
                active -> AggregateStatus.orphaned(Set.of(groupKey)),
                orphaned -> orphaned.withSupersededBy(groupKey));
    }

    private void validate(RawEvent event) {
        if (event == null) {
            throw new EventValidationException("Raw event is required");
        }
        if (isBlank(event.verb())) {
            throw EventValidationException.missingField("verb");
        }
        if (isBlank(event.actorId())) {
            throw EventValidationException.missingField("actorId");
        }
        if (isBlank(event.objectId())) {
            throw EventValidationException.missingField("objectId");
        }
        if (event.timestamp() == null) {
            throw EventValidationException.missingField("timestamp");
        }
        registry.require(event.verb());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Back off between conflicting attempts.
     * Package-private for testing.
     */
    void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Interrupted while retrying aggregation");
        }
    }

    private record Candidate(int order, GroupingRule rule, GroupKey key, AggregateState stored, AggregateState merged) {
    }

    private record Subsumption(AggregateState orphaned, String activityId) {
    }
}
