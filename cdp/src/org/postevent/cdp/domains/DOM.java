package org.postevent.cdp.domains;

public interface DOM {
    void enable();
}
