package io.github.gitstore.git;

import java.util.Locale;
import java.util.regex.Pattern;
import org.eclipse.jgit.api.errors.CheckoutConflictException;
import org.jetbrains.annotations.Nullable;

/** Maps exceptions raised by Git operations onto the closed {@link GitErrorKind} taxonomy. */
public final class GitErrorClassifier {
    private static final Pattern HTTP_401 = Pattern.compile("\\b401\\b");

    private GitErrorClassifier() {}

    public static GitErrorKind classify(@Nullable Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof GitOperationException goe) {
                return goe.getKind();
            }
            if (t instanceof CheckoutConflictException
                    || t instanceof org.eclipse.jgit.errors.CheckoutConflictException) {
                return GitErrorKind.CHECKOUT_CONFLICT;
            }
            if (t instanceof org.eclipse.jgit.api.errors.TransportException
                    || t instanceof org.eclipse.jgit.errors.TransportException) {
                return classifyTransport(t);
            }
        }
        return GitErrorKind.UNKNOWN;
    }

    private static GitErrorKind classifyTransport(Throwable transportError) {
        for (Throwable t = transportError; t != null; t = t.getCause() == t ? null : t.getCause()) {
            var message = t.getMessage() == null ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("no credentialsprovider")) {
                return GitErrorKind.MISSING_PASSWORD;
            }
            if (message.contains("not authorized") || HTTP_401.matcher(message).find()) {
                return GitErrorKind.HTTP_UNAUTHORIZED;
            }
        }
        return GitErrorKind.TRANSPORT;
    }
}
