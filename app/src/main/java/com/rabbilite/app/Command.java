package com.rabbilite.app;

import java.util.Locale;

/** Parsed command line. */
public record Command(Verb verb, String target, String payload) {

    public enum Verb { SEND, BROADCAST, CONSUME, SUBSCRIBE }

    public static Command parse(String[] args) {
        if (args.length < 2) {
            throw new IllegalArgumentException("missing arguments");
        }
        Verb verb;
        try {
            verb = Verb.valueOf(args[0].trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown command: " + args[0]);
        }
        String target = args[1].trim();
        if (target.isEmpty()) {
            throw new IllegalArgumentException("queue/exchange name must not be blank");
        }
        boolean publish = verb == Verb.SEND || verb == Verb.BROADCAST;
        if (publish && args.length < 3) {
            throw new IllegalArgumentException(verb.name().toLowerCase(Locale.ROOT) + " needs a JSON payload");
        }
        if (!publish && args.length > 2) {
            throw new IllegalArgumentException("unexpected argument: " + args[2]);
        }
        return new Command(verb, target, publish ? args[2] : null);
    }

    public boolean isPublish() {
        return verb == Verb.SEND || verb == Verb.BROADCAST;
    }
}
