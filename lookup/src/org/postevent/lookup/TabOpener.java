package org.postevent.lookup;

import org.postevent.cdp.Tab;

@FunctionalInterface
public interface TabOpener {
    Tab open();
}
