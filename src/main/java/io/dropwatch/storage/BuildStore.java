package io.dropwatch.storage;

import io.dropwatch.model.BuildSnapshot;
import io.dropwatch.model.BuildStatus;
import io.dropwatch.model.BuildView;
import io.dropwatch.model.DropStatus;
import io.dropwatch.model.DropView;
import io.dropwatch.model.FailureKind;
import io.dropwatch.model.SpawnCircuit;
import io.dropwatch.model.TickLease;
import io.dropwatch.plan.PlanDocument;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Durable state of builds and drops.
 *
 * <p>Every mutation a supervisory cycle makes carries the tick-lease holder and is fenced in the same
 * statement: the row only changes while that holder owns an unexpired lease on the build. A write that
 * loses the fence returns a stale-lease outcome and is recorded in {@code lease_conflicts}.
 */
public final class BuildStore {
    private static final String LEASE_FENCE =
            "EXISTS(SELECT 1 FROM builds b WHERE b.slug=? AND b.lease_holder=? AND b.lease_expires_at_ms>?)";
    private static final String BUILD_COLUMNS = """
            slug,title,status,status_reason,lease_holder,lease_expires_at_ms,
            circuit_open,circuit_open_until_ms,circuit_open_reason,
            started_at_ms,last_progress_at_ms,created_at_ms,updated_at_ms,archived_at_ms
            """;
    private static final String DROP_COLUMNS = """
            slug,drop_id,wave,stream,stream_order,blocking,status,failure_kind,failure_reason,
            retry_count,retry_note,started_at_ms,worker_handle,updated_at_ms
            """;

    private final Database database;

    public BuildStore(Database database) {
        this.database = database;
    }

    public BuildView createBuild(PlanDocument plan, long nowMs) {
        if (getBuild(plan.slug()).isPresent()) {
            throw new IllegalArgumentException("Build already exists: " + plan.slug());
        }
        Map<String, Integer> wavePositions = new LinkedHashMap<>();
        for (String wave : plan.waves().keySet()) {
            wavePositions.put(wave, wavePositions.size());
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement b = c.prepareStatement(
                    "INSERT INTO builds(slug,title,status,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?)");
                 PreparedStatement w = c.prepareStatement(
                         "INSERT INTO waves(slug,wave,position) VALUES(?,?,?)");
                 PreparedStatement d = c.prepareStatement(
                         "INSERT INTO drops(slug,drop_id,wave,wave_position,stream,stream_order,blocking,status,created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?)");
                 PreparedStatement dep = c.prepareStatement(
                         "INSERT INTO drop_dependencies(slug,drop_id,depends_on) VALUES(?,?,?)")) {
                b.setString(1, plan.slug());
                b.setString(2, plan.title() == null ? "" : plan.title());
                b.setString(3, BuildStatus.ACTIVE.name());
                b.setLong(4, nowMs);
                b.setLong(5, nowMs);
                b.executeUpdate();

                for (Map.Entry<String, Integer> wave : wavePositions.entrySet()) {
                    w.setString(1, plan.slug());
                    w.setString(2, wave.getKey());
                    w.setInt(3, wave.getValue());
                    w.executeUpdate();
                }
                for (PlanDocument.PlanDrop drop : plan.drops()) {
                    d.setString(1, plan.slug());
                    d.setString(2, drop.id());
                    d.setString(3, drop.wave());
                    d.setInt(4, plan.waves().get(drop.wave()).indexOf(drop.id()));
                    d.setInt(5, drop.stream());
                    d.setInt(6, drop.order());
                    d.setInt(7, drop.blocking() ? 1 : 0);
                    d.setString(8, DropStatus.PENDING.name());
                    d.setLong(9, nowMs);
                    d.setLong(10, nowMs);
                    d.executeUpdate();
                    for (String target : drop.dependsOn()) {
                        dep.setString(1, plan.slug());
                        dep.setString(2, drop.id());
                        dep.setString(3, target);
                        dep.executeUpdate();
                    }
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to create build: " + plan.slug(), e);
        }
        return getBuild(plan.slug()).orElseThrow();
    }

    public Optional<BuildView> getBuild(String slug) {
        String sql = "SELECT " + BUILD_COLUMNS + " FROM builds WHERE slug=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readBuild(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read build: " + slug, e);
        }
    }

    public List<BuildView> listBuilds(BuildStatus status) {
        String sql = status == null
                ? "SELECT " + BUILD_COLUMNS + " FROM builds ORDER BY created_at_ms, slug"
                : "SELECT " + BUILD_COLUMNS + " FROM builds WHERE status=? ORDER BY created_at_ms, slug";
        List<BuildView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (status != null) {
                ps.setString(1, status.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readBuild(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list builds", e);
        }
    }

    public List<DropView> listDrops(String slug) {
        Map<String, List<String>> deps = readDependencies(slug);
        String sql = "SELECT " + DROP_COLUMNS + " FROM drops d WHERE slug=? "
                + "ORDER BY (SELECT position FROM waves w WHERE w.slug=d.slug AND w.wave=d.wave), wave_position, drop_id";
        List<DropView> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readDrop(rs, deps));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list drops: " + slug, e);
        }
    }

    public Optional<DropView> getDrop(String slug, String dropId) {
        return listDrops(slug).stream().filter(d -> d.dropId().equals(dropId)).findFirst();
    }

    public Optional<BuildSnapshot> snapshot(String slug) {
        Optional<BuildView> build = getBuild(slug);
        if (build.isEmpty()) {
            return Optional.empty();
        }
        List<DropView> drops = listDrops(slug);
        Map<String, List<String>> waves = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT wave FROM waves WHERE slug=? ORDER BY position")) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    waves.put(rs.getString("wave"), new ArrayList<>());
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read waves: " + slug, e);
        }
        for (DropView d : drops) {
            waves.computeIfAbsent(d.wave(), k -> new ArrayList<>()).add(d.dropId());
        }
        return Optional.of(new BuildSnapshot(build.get(), waves, drops));
    }

    public LeaseGrant tryAcquireTickLease(String slug, String holder, long ttlMs, long nowMs) {
        long expiresAt = nowMs + Math.max(1L, ttlMs);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement up = c.prepareStatement(
                    "UPDATE builds SET lease_holder=?,lease_expires_at_ms=?,lease_acquired_at_ms=?,updated_at_ms=? "
                            + "WHERE slug=? AND (lease_holder IS NULL OR lease_expires_at_ms<=?)")) {
                TickLease previous = readLease(c, slug);
                if (previous == null) {
                    c.rollback();
                    throw new IllegalArgumentException("Build not found: " + slug);
                }
                up.setString(1, holder);
                up.setLong(2, expiresAt);
                up.setLong(3, nowMs);
                up.setLong(4, nowMs);
                up.setString(5, slug);
                up.setLong(6, nowMs);
                if (up.executeUpdate() == 0) {
                    TickLease actual = readLease(c, slug);
                    recordLeaseConflict(c, "lease_busy", slug, null, holder, actual, nowMs);
                    c.commit();
                    return LeaseGrant.busy(actual == null ? null : actual.holder(), actual == null ? 0L : actual.expiresAtMs());
                }
                c.commit();
                String takenOverFrom = previous.holder() != null && !previous.holder().equals(holder)
                        ? previous.holder()
                        : null;
                return LeaseGrant.acquired(holder, expiresAt, takenOverFrom);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new RuntimeException("Failed to acquire tick lease: " + slug, e);
        }
    }

    public boolean renewTickLease(String slug, String holder, long ttlMs, long nowMs) {
        String sql = "UPDATE builds SET lease_expires_at_ms=?,updated_at_ms=? WHERE slug=? AND lease_holder=? AND lease_expires_at_ms>?";
        return executeUpdate(sql, "Failed to renew tick lease: " + slug,
                nowMs + Math.max(1L, ttlMs), nowMs, slug, holder, nowMs) > 0;
    }

    /**
     * Clears the lease only when {@code holder} is still the recorded holder.
     */
    public boolean releaseTickLease(String slug, String holder) {
        String sql = "UPDATE builds SET lease_holder=NULL,lease_expires_at_ms=0 WHERE slug=? AND lease_holder=?";
        return executeUpdate(sql, "Failed to release tick lease: " + slug, slug, holder) > 0;
    }

    public DropTransition markRunning(String slug, String dropId, String holder, String workerHandle, long nowMs) {
        return updateDrop(slug, dropId, holder, nowMs, DropStatus.RUNNING, EnumSet.of(DropStatus.PENDING),
                "started_at_ms=?,worker_handle=?,failure_kind=NULL,failure_reason=NULL",
                nowMs, workerHandle);
    }

    public DropTransition markComplete(String slug, String dropId, String holder, Set<DropStatus> from, long nowMs) {
        return updateDrop(slug, dropId, holder, nowMs, DropStatus.COMPLETE, from,
                "failure_kind=NULL,failure_reason=NULL");
    }

    public DropTransition markBroken(String slug, String dropId, String holder, DropStatus to, FailureKind kind,
                                     String reason, Set<DropStatus> from, long nowMs) {
        if (!to.broken()) {
            throw new IllegalArgumentException("Not a failure status: " + to);
        }
        return updateDrop(slug, dropId, holder, nowMs, to, from,
                "failure_kind=?,failure_reason=?",
                kind.name(), reason);
    }

    public DropTransition resetForRetry(String slug, String dropId, String holder, String note, long nowMs) {
        return updateDrop(slug, dropId, holder, nowMs, DropStatus.PENDING, EnumSet.of(DropStatus.FAILED, DropStatus.DEAD),
                "retry_count=retry_count+1,retry_note=?,started_at_ms=NULL,worker_handle=NULL,failure_kind=NULL,failure_reason=NULL",
                note);
    }

    public boolean setBuildStatus(String slug, String holder, Set<BuildStatus> from, BuildStatus to, String reason, long nowMs) {
        String placeholders = placeholders(from.size());
        String sql = "UPDATE builds SET status=?,status_reason=?,updated_at_ms=?,"
                + "archived_at_ms=CASE WHEN ? THEN COALESCE(archived_at_ms, ?) ELSE archived_at_ms END "
                + "WHERE slug=? AND status IN (" + placeholders + ") AND " + LEASE_FENCE;
        List<Object> params = new ArrayList<>();
        params.add(to.name());
        params.add(reason);
        params.add(nowMs);
        params.add(to.terminal() ? 1 : 0);
        params.add(nowMs);
        params.add(slug);
        from.forEach(s -> params.add(s.name()));
        params.add(slug);
        params.add(holder);
        params.add(nowMs);
        return fencedWrite(sql, params, slug, null, holder, nowMs, "Failed to update build status: " + slug);
    }

    public boolean openCircuit(String slug, String holder, long openUntilMs, String reason, long nowMs) {
        String sql = "UPDATE builds SET circuit_open=1,circuit_open_until_ms=?,circuit_open_reason=?,updated_at_ms=? WHERE slug=? AND " + LEASE_FENCE;
        return fencedWrite(sql, Arrays.asList(openUntilMs, reason, nowMs, slug, slug, holder, nowMs),
                slug, null, holder, nowMs, "Failed to open spawn circuit: " + slug);
    }

    public boolean closeCircuit(String slug, String holder, long nowMs) {
        String sql = "UPDATE builds SET circuit_open=0,circuit_open_until_ms=0,circuit_open_reason=NULL,updated_at_ms=? WHERE slug=? AND " + LEASE_FENCE;
        return fencedWrite(sql, Arrays.asList(nowMs, slug, slug, holder, nowMs),
                slug, null, holder, nowMs, "Failed to close spawn circuit: " + slug);
    }

    public boolean recordSpawnFailure(String slug, String dropId, String holder, String reason, long nowMs) {
        String sql = "INSERT INTO spawn_failures(slug,drop_id,reason,occurred_at_ms) SELECT ?,?,?,? WHERE " + LEASE_FENCE;
        return fencedWrite(sql, Arrays.asList(slug, dropId, reason == null ? "" : reason, nowMs, slug, holder, nowMs),
                slug, dropId, holder, nowMs, "Failed to record spawn failure: " + slug);
    }

    public int countSpawnFailuresSince(String slug, long sinceMs) {
        String sql = "SELECT COUNT(1) FROM spawn_failures WHERE slug=? AND occurred_at_ms>=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, slug);
            ps.setLong(2, sinceMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count spawn failures: " + slug, e);
        }
    }

    public int clearSpawnFailures(String slug, String holder, long nowMs) {
        String sql = "DELETE FROM spawn_failures WHERE slug=? AND " + LEASE_FENCE;
        return executeUpdate(sql, "Failed to clear spawn failures: " + slug, slug, slug, holder, nowMs);
    }

    public void recordRecoveryAction(RecoveryActionRow row) {
        String sql = """
                INSERT INTO recovery_actions(slug,drop_id,rule,action,failure_kind,reason,holder,applied,occurred_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                """;
        executeUpdate(sql, "Failed to record recovery action: " + row.slug(),
                row.slug(), row.dropId(), row.rule(), row.action(), row.failureKind(), row.reason(),
                row.holder(), row.applied() ? 1 : 0, row.occurredAtMs());
    }

    public List<RecoveryActionRow> listRecoveryActions(String slug, int limit) {
        String sql = """
                SELECT slug,drop_id,rule,action,failure_kind,reason,holder,applied,occurred_at_ms
                FROM recovery_actions WHERE slug=? ORDER BY occurred_at_ms DESC, id DESC LIMIT ?
                """;
        List<RecoveryActionRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, slug);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new RecoveryActionRow(
                            rs.getString("slug"),
                            rs.getString("drop_id"),
                            rs.getString("rule"),
                            rs.getString("action"),
                            rs.getString("failure_kind"),
                            rs.getString("reason"),
                            rs.getString("holder"),
                            rs.getInt("applied") == 1,
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list recovery actions: " + slug, e);
        }
    }

    public List<LeaseConflict> listLeaseConflicts(String slug, int limit) {
        String sql = """
                SELECT event_type,slug,drop_id,requested_holder,actual_holder,actual_expires_at_ms,occurred_at_ms
                FROM lease_conflicts WHERE slug=? ORDER BY occurred_at_ms DESC, id DESC LIMIT ?
                """;
        List<LeaseConflict> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, slug);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new LeaseConflict(
                            rs.getString("event_type"),
                            rs.getString("slug"),
                            rs.getString("drop_id"),
                            rs.getString("requested_holder"),
                            rs.getString("actual_holder"),
                            nullableLong(rs, "actual_expires_at_ms"),
                            rs.getLong("occurred_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list lease conflicts: " + slug, e);
        }
    }

    private DropTransition updateDrop(String slug, String dropId, String holder, long nowMs, DropStatus to,
                                      Set<DropStatus> from, String setClause, Object... setParams) {
        String sql = "UPDATE drops SET " + setClause + ",status=?,updated_at_ms=? "
                + "WHERE slug=? AND drop_id=? AND status IN (" + placeholders(from.size()) + ") AND " + LEASE_FENCE;
        List<Object> params = new ArrayList<>(Arrays.asList(setParams));
        params.add(to.name());
        params.add(nowMs);
        params.add(slug);
        params.add(dropId);
        from.forEach(s -> params.add(s.name()));
        params.add(slug);
        params.add(holder);
        params.add(nowMs);
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql);
                 PreparedStatement progress = c.prepareStatement(
                         "UPDATE builds SET last_progress_at_ms=?,started_at_ms=COALESCE(started_at_ms, ?),updated_at_ms=? WHERE slug=?")) {
                bind(ps, params);
                if (ps.executeUpdate() == 0) {
                    DropTransition miss;
                    if (!leaseHeld(c, slug, holder, nowMs)) {
                        recordLeaseConflict(c, "stale_write", slug, dropId, holder, readLease(c, slug), nowMs);
                        miss = DropTransition.staleLease(dropId, to);
                    } else if (readDropStatus(c, slug, dropId) == null) {
                        miss = DropTransition.notFound(dropId, to);
                    } else {
                        miss = DropTransition.wrongState(dropId, to, readDropStatus(c, slug, dropId));
                    }
                    c.commit();
                    return miss;
                }
                progress.setLong(1, nowMs);
                progress.setLong(2, nowMs);
                progress.setLong(3, nowMs);
                progress.setString(4, slug);
                progress.executeUpdate();
                c.commit();
                return DropTransition.applied(dropId, to);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to move drop " + slug + "/" + dropId + " to " + to, e);
        }
    }

    private boolean fencedWrite(String sql, List<Object> params, String slug, String dropId, String holder,
                                long nowMs, String failure) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, params);
            if (ps.executeUpdate() > 0) {
                return true;
            }
            if (!leaseHeld(c, slug, holder, nowMs)) {
                recordLeaseConflict(c, "stale_write", slug, dropId, holder, readLease(c, slug), nowMs);
            }
            return false;
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    private int executeUpdate(String sql, String failure, Object... params) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, Arrays.asList(params));
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    private void bind(PreparedStatement ps, Collection<Object> params) throws SQLException {
        int i = 1;
        for (Object p : params) {
            ps.setObject(i++, p);
        }
    }

    private boolean leaseHeld(Connection c, String slug, String holder, long nowMs) throws SQLException {
        TickLease lease = readLease(c, slug);
        return lease != null && lease.heldBy(holder, nowMs);
    }

    private TickLease readLease(Connection c, String slug) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT lease_holder,lease_expires_at_ms FROM builds WHERE slug=?")) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                return new TickLease(rs.getString("lease_holder"), rs.getLong("lease_expires_at_ms"));
            }
        }
    }

    private DropStatus readDropStatus(Connection c, String slug, String dropId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT status FROM drops WHERE slug=? AND drop_id=?")) {
            ps.setString(1, slug);
            ps.setString(2, dropId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? DropStatus.valueOf(rs.getString("status")) : null;
            }
        }
    }

    private void recordLeaseConflict(Connection c, String eventType, String slug, String dropId,
                                     String requestedHolder, TickLease actual, long nowMs) {
        String sql = """
                INSERT INTO lease_conflicts(event_type,slug,drop_id,requested_holder,actual_holder,actual_expires_at_ms,occurred_at_ms)
                VALUES(?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, eventType);
            ps.setString(2, slug);
            ps.setString(3, dropId);
            ps.setString(4, requestedHolder);
            ps.setString(5, actual == null ? null : actual.holder());
            if (actual == null) {
                ps.setObject(6, null);
            } else {
                ps.setLong(6, actual.expiresAtMs());
            }
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record lease conflict", e);
        }
    }

    private Map<String, List<String>> readDependencies(String slug) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        String sql = "SELECT drop_id,depends_on FROM drop_dependencies WHERE slug=? ORDER BY drop_id, depends_on";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, slug);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.computeIfAbsent(rs.getString("drop_id"), k -> new ArrayList<>()).add(rs.getString("depends_on"));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read drop dependencies: " + slug, e);
        }
    }

    private BuildView readBuild(ResultSet rs) throws SQLException {
        return new BuildView(
                rs.getString("slug"),
                rs.getString("title"),
                BuildStatus.valueOf(rs.getString("status")),
                rs.getString("status_reason"),
                new TickLease(rs.getString("lease_holder"), rs.getLong("lease_expires_at_ms")),
                new SpawnCircuit(
                        rs.getInt("circuit_open") == 1,
                        rs.getLong("circuit_open_until_ms"),
                        rs.getString("circuit_open_reason")
                ),
                nullableLong(rs, "started_at_ms"),
                nullableLong(rs, "last_progress_at_ms"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                nullableLong(rs, "archived_at_ms")
        );
    }

    private DropView readDrop(ResultSet rs, Map<String, List<String>> deps) throws SQLException {
        String dropId = rs.getString("drop_id");
        String kind = rs.getString("failure_kind");
        return new DropView(
                rs.getString("slug"),
                dropId,
                rs.getString("wave"),
                rs.getInt("stream"),
                rs.getInt("stream_order"),
                rs.getInt("blocking") == 1,
                DropStatus.valueOf(rs.getString("status")),
                kind == null ? null : FailureKind.valueOf(kind),
                rs.getString("failure_reason"),
                rs.getInt("retry_count"),
                rs.getString("retry_note"),
                nullableLong(rs, "started_at_ms"),
                rs.getString("worker_handle"),
                deps.getOrDefault(dropId, List.of()),
                rs.getLong("updated_at_ms")
        );
    }

    private static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    private static String placeholders(int n) {
        return IntStream.range(0, Math.max(1, n))
                .mapToObj(i -> "?")
                .collect(Collectors.joining(","));
    }

    public enum TransitionOutcome { APPLIED, STALE_LEASE, WRONG_STATE, NOT_FOUND }

    public record DropTransition(TransitionOutcome outcome, String dropId, DropStatus target, DropStatus actual) {
        public static DropTransition applied(String dropId, DropStatus target) { return new DropTransition(TransitionOutcome.APPLIED, dropId, target, target); }
        public static DropTransition staleLease(String dropId, DropStatus target) { return new DropTransition(TransitionOutcome.STALE_LEASE, dropId, target, null); }
        public static DropTransition wrongState(String dropId, DropStatus target, DropStatus actual) { return new DropTransition(TransitionOutcome.WRONG_STATE, dropId, target, actual); }
        public static DropTransition notFound(String dropId, DropStatus target) { return new DropTransition(TransitionOutcome.NOT_FOUND, dropId, target, null); }

        public boolean isApplied() {
            return outcome == TransitionOutcome.APPLIED;
        }
    }

    public record LeaseGrant(boolean acquired, String holder, long expiresAtMs, String takenOverFrom) {
        public static LeaseGrant acquired(String holder, long expiresAtMs, String takenOverFrom) {
            return new LeaseGrant(true, holder, expiresAtMs, takenOverFrom);
        }

        public static LeaseGrant busy(String currentHolder, long currentExpiresAtMs) {
            return new LeaseGrant(false, currentHolder, currentExpiresAtMs, null);
        }
    }

    public record RecoveryActionRow(
            String slug,
            String dropId,
            String rule,
            String action,
            String failureKind,
            String reason,
            String holder,
            boolean applied,
            long occurredAtMs
    ) {
    }

    public record LeaseConflict(
            String eventType,
            String slug,
            String dropId,
            String requestedHolder,
            String actualHolder,
            Long actualExpiresAtMs,
            long occurredAtMs
    ) {
    }
}
