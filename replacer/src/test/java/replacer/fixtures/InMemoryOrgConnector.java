package replacer.fixtures;

import replacer.connector.OrgConnector;
import replacer.exceptions.ConnectorException;
import replacer.exceptions.ConnectorTimeoutException;
import replacer.exceptions.DeployValidationException;
import replacer.exceptions.MetadataNotFoundException;
import replacer.model.DeployResult;
import replacer.model.DeployStatus;
import replacer.model.FieldReference;
import replacer.model.OrgContext;
import replacer.model.ReportDescriptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Fake org holding fields and report definitions in memory.
 *
 * <p>Failures can be scripted per operation ({@code fieldExists}, {@code find},
 * {@code retrieve}, {@code startDeploy}, {@code checkDeploy}); each scripted failure is thrown
 * once, in order. Deploys complete after a configurable number of polls and can be rejected
 * by deploy number. Every call is recorded.
 */
public class InMemoryOrgConnector implements OrgConnector {

    private final Clock clock;
    private final Set<FieldReference> fields = new HashSet<>();
    private final Map<String, ReportDescriptor> reports = new TreeMap<>();
    private final Map<String, Deque<Exception>> failures = new HashMap<>();
    private final Map<Integer, List<String>> rejectedDeploys = new HashMap<>();
    private final Map<String, PendingDeploy> deploys = new LinkedHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final List<DeployCall> deployCalls = new ArrayList<>();

    private int pollsUntilDone = 1;
    private boolean searchReturnsAll;
    private boolean neverFinish;

    public InMemoryOrgConnector(Clock clock) {
        this.clock = clock;
    }

    public record DeployCall(String deployId, Instant at, List<String> reportIds) {
    }

    private static final class PendingDeploy {
        final int number;
        final List<ReportDescriptor> reports;
        int pollsLeft;

        PendingDeploy(int number, List<ReportDescriptor> reports, int pollsLeft) {
            this.number = number;
            this.reports = reports;
            this.pollsLeft = pollsLeft;
        }
    }

    // ---- setup ----

    public InMemoryOrgConnector withField(String qualified) {
        fields.add(FieldReference.parse(qualified));
        return this;
    }

    public InMemoryOrgConnector withReport(String reportId, String fullName, String definition) {
        reports.put(reportId, new ReportDescriptor(reportId, fullName, null, definition));
        return this;
    }

    public InMemoryOrgConnector failNext(String operation, ConnectorException error) {
        failures.computeIfAbsent(operation, k -> new ArrayDeque<>()).add(error);
        return this;
    }

    /** Fails the next call of the operation as if it had exceeded the connector timeout. */
    public InMemoryOrgConnector timeOutNext(String operation) {
        failures.computeIfAbsent(operation, k -> new ArrayDeque<>())
                .add(new ConnectorTimeoutException(operation, Duration.ofSeconds(600)));
        return this;
    }

    /** Rejects the n-th deploy (1-based) with the given component failures. */
    public InMemoryOrgConnector rejectDeploy(int deployNumber, String... componentFailures) {
        rejectedDeploys.put(deployNumber, List.of(componentFailures));
        return this;
    }

    public InMemoryOrgConnector pollsUntilDone(int polls) {
        this.pollsUntilDone = polls;
        return this;
    }

    public InMemoryOrgConnector searchReturnsAll(boolean all) {
        this.searchReturnsAll = all;
        return this;
    }

    public InMemoryOrgConnector neverFinishDeploys() {
        this.neverFinish = true;
        return this;
    }

    // ---- inspection ----

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callCount(String operation) {
        return calls().stream().filter(operation::equals).count();
    }

    public List<DeployCall> deployCalls() {
        return List.copyOf(deployCalls);
    }

    public String definition(String reportId) {
        return reports.get(reportId).rawDefinition();
    }

    // ---- OrgConnector ----

    @Override
    public boolean fieldExists(OrgContext ctx, FieldReference field) throws ConnectorException {
        enter("fieldExists");
        return fields.contains(field);
    }

    @Override
    public List<ReportDescriptor> findReportsReferencing(OrgContext ctx, FieldReference field)
            throws ConnectorException {
        enter("find");
        List<ReportDescriptor> found = new ArrayList<>();
        for (ReportDescriptor r : reports.values()) {
            if (searchReturnsAll || r.rawDefinition().contains(field.qualifiedName())) {
                found.add(ReportDescriptor.handle(r.reportId(), r.fullName()));
            }
        }
        // unordered on purpose: the locator sorts
        Collections.reverse(found);
        return found;
    }

    @Override
    public List<ReportDescriptor> retrieve(OrgContext ctx, List<ReportDescriptor> requested) throws ConnectorException {
        enter("retrieve");
        List<ReportDescriptor> out = new ArrayList<>();
        for (ReportDescriptor r : requested) {
            ReportDescriptor stored = reports.get(r.reportId());
            if (stored != null) out.add(stored);
        }
        if (out.isEmpty() && !requested.isEmpty()) {
            throw new MetadataNotFoundException("No requested report exists");
        }
        return out;
    }

    @Override
    public String startDeploy(OrgContext ctx, List<ReportDescriptor> toDeploy) throws ConnectorException {
        enter("startDeploy");
        int number = deploys.size() + 1;
        String deployId = String.format("0Af%012d", number);
        deploys.put(deployId, new PendingDeploy(number, List.copyOf(toDeploy), pollsUntilDone));
        deployCalls.add(new DeployCall(deployId, clock.instant(),
                toDeploy.stream().map(ReportDescriptor::reportId).toList()));
        return deployId;
    }

    @Override
    public DeployResult checkDeploy(OrgContext ctx, String deployId) throws ConnectorException {
        enter("checkDeploy");
        PendingDeploy pending = deploys.get(deployId);
        if (pending == null) {
            throw new MetadataNotFoundException("Unknown deploy " + deployId);
        }
        if (neverFinish || --pending.pollsLeft > 0) {
            return new DeployResult(deployId, DeployStatus.IN_PROGRESS, List.of());
        }
        List<String> rejected = rejectedDeploys.get(pending.number);
        if (rejected != null) {
            throw new DeployValidationException("Deploy rejected", deployId, rejected);
        }
        for (ReportDescriptor r : pending.reports) {
            reports.put(r.reportId(), r);
        }
        return DeployResult.succeeded(deployId);
    }

    private void enter(String operation) throws ConnectorException {
        calls.add(operation);
        Deque<Exception> queue = failures.get(operation);
        if (queue != null && !queue.isEmpty()) {
            Exception failure = queue.poll();
            if (failure instanceof ConnectorException) {
                throw (ConnectorException) failure;
            }
            throw (RuntimeException) failure;
        }
    }
}
