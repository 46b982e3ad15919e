package com.blockflow.pygen.util;

import com.blockflow.pygen.api.CompileListener;
import com.blockflow.pygen.api.Diagnostic;
import java.util.Arrays;

/**
 * Fans compile events out to several {@link CompileListener} instances, in
 * registration order.
 */
public class CompositeCompileListener implements CompileListener {
    private volatile CompileListener[] listeners = new CompileListener[0];

    public synchronized void addForComposite(CompileListener listener) {
        CompileListener[] old = listeners;
        CompileListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onCompileStart(long pass) {
        for (CompileListener l : listeners)
            l.onCompileStart(pass);
    }

    @Override
    public void onBlockEmitted(long pass, String blockId, String kind, long durationNanos) {
        for (CompileListener l : listeners)
            l.onBlockEmitted(pass, blockId, kind, durationNanos);
    }

    @Override
    public void onDiagnostic(long pass, Diagnostic diagnostic) {
        for (CompileListener l : listeners)
            l.onDiagnostic(pass, diagnostic);
    }

    @Override
    public void onCompileEnd(long pass, int blocksEmitted) {
        for (CompileListener l : listeners)
            l.onCompileEnd(pass, blocksEmitted);
    }
}
