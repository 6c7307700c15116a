package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.entity.ContainmentState;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.GeofenceEventType;
import com.lastmile.locationtracking.entity.NotificationPolicy;
import com.lastmile.locationtracking.exception.GeofenceGeometryException;
import com.lastmile.locationtracking.service.notification.NotificationSink;
import com.lastmile.locationtracking.store.GeofenceStore;
import com.lastmile.locationtracking.util.KeyedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Detects geofence transitions for one courier position.
 *
 * For every geofence active at the evaluation instant:
 *   1. inside    - point containment, boundary inclusive
 *   2. wasInside - stored containment state; missing or expired means outside
 *   3. event     - ENTER (out → in), EXIT (in → out), or DWELL once per inside
 *                  period after dwellDurationSec, if the policy enables dwell
 *   4. state     - persisted; since/dwellNotified reset on every flip
 *
 * Steps 2–4 and the event write run under the containment:{user}:{geofence}
 * lock, so concurrent samples of the same courier cannot both raise an ENTER.
 * Notifications are sent after the lock is released; a failing sink is
 * logged and never undoes the recorded event.
 */
@Service
@Slf4j
public class GeofenceEvaluator {

    private final CacheableGeofenceService geofences;
    private final GeofenceStore geofenceStore;
    private final KeyedLocks locks;
    private final NotificationSink notificationSink;
    private final Clock clock;
    private final Duration containmentTtl;

    public GeofenceEvaluator(CacheableGeofenceService geofences,
                             GeofenceStore geofenceStore,
                             KeyedLocks locks,
                             NotificationSink notificationSink,
                             Clock clock,
                             @Value("${tracking.geofence.containment-ttl-seconds:3600}") long containmentTtlSeconds) {
        this.geofences = geofences;
        this.geofenceStore = geofenceStore;
        this.locks = locks;
        this.notificationSink = notificationSink;
        this.clock = clock;
        this.containmentTtl = Duration.ofSeconds(containmentTtlSeconds);
    }

    public List<GeofenceEvent> evaluate(String tripId, String userId, Coordinates coordinates) {
        return evaluate(tripId, userId, coordinates, clock.instant());
    }

    /**
     * @param at instant the position was observed; used for the active window,
     *           dwell timing and the event timestamp
     * @return events raised, in geofence order
     */
    public List<GeofenceEvent> evaluate(String tripId, String userId, Coordinates coordinates, Instant at) {
        List<GeofenceEvent> raised = new ArrayList<>();

        for (Geofence geofence : geofences.getGeofencesForTrip(tripId)) {
            if (!geofence.isActiveAt(at)) {
                continue;
            }
            boolean inside;
            try {
                inside = GeofenceGeometries.of(geofence).contains(coordinates);
            } catch (GeofenceGeometryException e) {
                // state is left untouched: a broken shape must not produce a phantom EXIT
                log.error("GEOFENCE: Skipping geofence #{} with unusable geometry — {}", geofence.getId(), e.getMessage());
                continue;
            }

            List<GeofenceEvent> events = locks.withLock(
                    KeyedLocks.containmentKey(userId, geofence.getId()),
                    () -> transition(tripId, userId, geofence, coordinates, inside, at));

            for (GeofenceEvent event : events) {
                dispatch(event, geofence);
            }
            raised.addAll(events);
        }
        return raised;
    }

    private List<GeofenceEvent> transition(String tripId, String userId, Geofence geofence,
                                           Coordinates coordinates, boolean inside, Instant at) {
        Optional<ContainmentState> previous = geofenceStore.getContainmentState(userId, geofence.getId())
                .filter(state -> !state.isExpired(at, containmentTtl));
        boolean wasInside = previous.map(ContainmentState::isInside).orElse(false);
        NotificationPolicy policy = geofence.policy();

        List<GeofenceEvent> events = new ArrayList<>(1);
        ContainmentState next;

        if (inside != wasInside) {
            GeofenceEventType kind = inside ? GeofenceEventType.ENTER : GeofenceEventType.EXIT;
            events.add(record(tripId, userId, geofence, kind, coordinates, at, null));
            next = ContainmentState.builder()
                    .userId(userId)
                    .geofenceId(geofence.getId())
                    .inside(inside)
                    .since(at)
                    .dwellNotified(false)
                    .updatedAt(at)
                    .build();
        } else if (previous.isPresent()) {
            next = previous.get().toBuilder().updatedAt(at).build();
            if (inside && policy.isDwellEnabled() && !next.isDwellNotified()) {
                long dwellSeconds = Duration.between(next.getSince(), at).getSeconds();
                if (dwellSeconds >= policy.getDwellDurationSec()) {
                    events.add(record(tripId, userId, geofence, GeofenceEventType.DWELL, coordinates, at, dwellSeconds));
                    next.setDwellNotified(true);
                }
            }
        } else {
            // outside and nothing remembered: nothing to write
            return events;
        }

        geofenceStore.putContainmentState(next);
        return events;
    }

    private GeofenceEvent record(String tripId, String userId, Geofence geofence, GeofenceEventType kind,
                                 Coordinates coordinates, Instant at, Long dwellSeconds) {
        GeofenceEvent saved = geofenceStore.appendEvent(GeofenceEvent.builder()
                .geofenceId(geofence.getId())
                .userId(userId)
                .tripId(tripId)
                .kind(kind)
                .coordinates(Coordinates.of(coordinates.getLatitude(), coordinates.getLongitude()))
                .dwellSeconds(dwellSeconds)
                .triggeredAt(at)
                .build());
        log.info("AUDIT: {} persisted — geofence #{} ({}), user: {}, trip: {}{}",
                kind, geofence.getId(), geofence.getKind(), userId, tripId,
                dwellSeconds != null ? ", dwell: " + dwellSeconds + "s" : "");
        return saved;
    }

    private void dispatch(GeofenceEvent event, Geofence geofence) {
        if (!geofence.policy().allows(event.getKind())) {
            return;
        }
        try {
            notificationSink.notify(event, geofence);
        } catch (RuntimeException e) {
            log.error("NOTIFY: Failed to deliver {} for geofence #{} to user {} — {}",
                    event.getKind(), geofence.getId(), event.getUserId(), e.getMessage());
        }
    }
}
