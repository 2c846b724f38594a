package com.libragraph.keeper.core.error;

import com.libragraph.keeper.core.service.FatalServiceException;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Cause-chain helpers shared by the supervision code.
 */
public final class Errors {

    private Errors() {
    }

    public static boolean isCancellation(Throwable t) {
        return hasCause(t, CancellationException.class);
    }

    public static boolean isFatal(Throwable t) {
        return hasCause(t, FatalServiceException.class);
    }

    public static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable cur = t; cur != null && seen.add(cur); cur = cur.getCause()) {
            if (type.isInstance(cur)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Joins the messages of a cause chain with {@code ": "}, e.g.
     * {@code "service run failed: connection refused"}. Throwables without a message
     * contribute their simple class name; a message repeated by the next cause is
     * written once.
     */
    public static String describe(Throwable t) {
        if (t == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        String previous = null;
        for (Throwable cur = t; cur != null && seen.add(cur); cur = cur.getCause()) {
            String msg = cur.getMessage();
            if (msg == null || msg.isEmpty()) {
                msg = cur.getClass().getSimpleName();
            }
            if (previous != null && (previous.equals(msg) || previous.endsWith(msg))) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(": ");
            }
            sb.append(msg);
            previous = msg;
        }
        return sb.toString();
    }
}
