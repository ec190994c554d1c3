package com.example.renderflow.engine;

import java.io.IOException;

public class ProcessEncoderLauncher implements EncoderLauncher {

    @Override
    public Process launch(EncoderCommand command) throws IOException {
        return new ProcessBuilder(command.commandLine())
                .redirectErrorStream(true)
                .start();
    }
}
