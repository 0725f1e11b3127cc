package org.stianloader.picodep.internal;

import java.util.concurrent.CompletionException;

class MultiCompletionException extends CompletionException {

    private static final long serialVersionUID = -3361756801104382585L;

    MultiCompletionException(Throwable[] causers) {
        super("All futures completed exceptionally");
        for (Throwable t : causers) {
            if (t == null) {
                continue;
            }
            this.addSuppressed(t);
        }
    }
}
