package wingman;

import wingman.cli.WingmanCommand;

/**
 * Command-line entry point.
 */
public final class Wingman {

    private Wingman() {
    }

    public static void main(String[] args) {
        System.exit(WingmanCommand.commandLine(new WingmanCommand()).execute(args));
    }
}
