package io.stageflow.core.process;

import java.io.Serial;

/// Thrown when a stage name does not exist in a process.
public class StageNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 4127730516297342610L;

    private final String stageName;

    public StageNotFoundException(String stageName) {
        super("Stage '" + stageName + "' not found in process");
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
