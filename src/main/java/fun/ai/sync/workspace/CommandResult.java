package fun.ai.sync.workspace;

public class CommandResult {
    public static final int TIMEOUT_EXIT_CODE = 124;

    private final int exitCode;
    private final String output;

    public CommandResult(int exitCode, String output) {
        this.exitCode = exitCode;
        this.output = output == null ? "" : output;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public boolean isTimeout() {
        return exitCode == TIMEOUT_EXIT_CODE;
    }
}
