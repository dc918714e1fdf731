package com.tyron.apphost.core.application;

/**
 * Thrown when a collaborator of the {@link ApplicationContext} is read before it was assigned,
 * typically because the application has not finished booting.
 */
public class ContextNotSetException extends IllegalStateException {

    private final String collaborator;

    public ContextNotSetException(String collaborator) {
        super("The " + collaborator + " has not been set on the ApplicationContext");
        this.collaborator = collaborator;
    }

    /**
     * @return the name of the missing collaborator, e.g. {@code "DatabaseContext"}.
     */
    public String getCollaborator() {
        return collaborator;
    }
}
