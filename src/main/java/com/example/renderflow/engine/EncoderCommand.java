package com.example.renderflow.engine;

import java.util.ArrayList;
import java.util.List;

/** Program plus argument vector for one encoder invocation. */
public record EncoderCommand(String program, List<String> args) {

    public EncoderCommand {
        args = List.copyOf(args);
    }

    public List<String> commandLine() {
        List<String> cmd = new ArrayList<>(args.size() + 1);
        cmd.add(program);
        cmd.addAll(args);
        return cmd;
    }
}
