package com.example.vitals.web;

import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
@PreMatching
public class RequestLoggingFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(RequestLoggingFilter.class);

    @Override
    public void filter(ContainerRequestContext request) {
        // never log the key itself
        String apiKey = request.getHeaderString(Headers.API_KEY);
        LOG.infof(
            "REQ: %s %s | CT: %s | X-API-Key: %b | Idem: %s",
            request.getMethod(),
            request.getUriInfo().getPath(),
            request.getMediaType(),
            apiKey != null && !apiKey.isEmpty(),
            request.getHeaderString(Headers.IDEMPOTENCY_KEY)
        );
    }
}
