package br.edu.ifba.graphrag.chat;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of the chat completions endpoint into exceptions that
 * carry the response body, so the generate step can report what went wrong.
 */
public class LlmChatClientExceptionMapper implements ResponseExceptionMapper<RuntimeException> {

    private static final Logger LOG = Logger.getLogger(LlmChatClientExceptionMapper.class);

    @Override
    public RuntimeException toThrowable(final Response response) {
        final int status = response.getStatus();
        if (status < 400) {
            return null;
        }

        String body = null;
        try {
            if (response.hasEntity()) {
                body = response.readEntity(String.class);
            }
        } catch (RuntimeException e) {
            LOG.warn("Failed to read error response body", e);
        }

        final String reason = response.getStatusInfo().getReasonPhrase();
        LOG.errorf("Chat completions call failed: %d %s, body: %s",
                Integer.valueOf(status), reason, body == null || body.isEmpty() ? "(empty)" : body);

        final String message = "LLM API returned " + status + " " + reason
                + (body != null && !body.isEmpty() ? " - " + body : "");
        return new WebApplicationException(message, response);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}
