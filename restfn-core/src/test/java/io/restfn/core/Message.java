package io.restfn.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class Message {
    @JsonProperty("Message")
    public String message;

    public Message() {
    }

    public Message(String message) {
        this.message = message;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Message other && Objects.equals(message, other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(message);
    }

    @Override
    public String toString() {
        return "Message[" + message + "]";
    }
}
