package com.trading.blueprint.util;

import com.trading.blueprint.api.GraphEvent;
import com.trading.blueprint.api.GraphListener;
import java.util.Arrays;

/**
 * Fans one graph event out to several {@link GraphListener} instances.
 *
 * <p>
 * The listener array is copied on change, so a listener may register or
 * unregister others while being notified.
 */
public class CompositeGraphListener implements GraphListener {
    private GraphListener[] listeners = new GraphListener[0];

    public void add(GraphListener listener) {
        GraphListener[] old = listeners;
        GraphListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean remove(GraphListener listener) {
        GraphListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                GraphListener[] next = new GraphListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onGraphChanged(GraphEvent event) {
        for (GraphListener l : listeners)
            l.onGraphChanged(event);
    }
}
