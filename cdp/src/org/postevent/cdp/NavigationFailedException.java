package org.postevent.cdp;

/**
 * The browser reported that the navigation itself failed, for example a DNS or connection error.
 */
public class NavigationFailedException extends NavigationException {
    private final String errorText;

    public NavigationFailedException(String url, String errorText) {
        super(url, errorText);
        this.errorText = errorText;
    }

    public String errorText() {
        return errorText;
    }
}
