package org.carball.futureyou.ai;

public class EmptyResponseException extends AgentException {

    public EmptyResponseException(String message) {
        super(message);
    }
}
