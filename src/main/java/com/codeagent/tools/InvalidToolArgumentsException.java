package com.codeagent.tools;

public class InvalidToolArgumentsException extends IllegalArgumentException {

    public InvalidToolArgumentsException(String message) {
        super(message);
    }
}
