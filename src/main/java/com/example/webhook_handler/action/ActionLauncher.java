package com.example.webhook_handler.action;

import java.nio.file.Path;

public interface ActionLauncher {

    /**
     * Start the script without waiting for it to finish.
     *
     * @return the running process
     * @throws ActionLaunchException if the process could not be started
     */
    Process launch(Path script);
}
