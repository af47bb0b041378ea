package dev.ebullient.gamemaster.state;

public class UnknownDomainException extends WorldStateException {

    public UnknownDomainException(String domain) {
        super(domain, "Unknown top-level domain: " + domain);
    }

    public String domain() {
        return path();
    }
}
