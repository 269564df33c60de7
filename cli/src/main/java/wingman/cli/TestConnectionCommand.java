package wingman.cli;

import replacer.exceptions.ConnectorException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "test-connection", description = "Check that the org can be queried")
class TestConnectionCommand implements Callable<Integer> {

    static final String PROBE_QUERY = "SELECT Id FROM User LIMIT 1";

    @ParentCommand
    WingmanCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = {"-o", "--org"}, description = "Org alias (overrides the global --org)")
    String org;

    @Override
    public Integer call() {
        String targetOrg = parent.resolveOrg(org, spec);
        PrintWriter out = spec.commandLine().getOut();
        try {
            parent.sf().query(targetOrg, PROBE_QUERY, false);
            out.println("Successfully connected to org: " + targetOrg);
            return 0;
        } catch (ConnectorException e) {
            out.println("Connection to " + targetOrg + " failed: " + e.getMessage());
            return 1;
        } finally {
            out.flush();
        }
    }
}
