package com.example.renderflow.engine;

import java.io.IOException;

/** Starts the external encoder. Output of the returned process must carry both stdout and stderr. */
public interface EncoderLauncher {
    Process launch(EncoderCommand command) throws IOException;
}
