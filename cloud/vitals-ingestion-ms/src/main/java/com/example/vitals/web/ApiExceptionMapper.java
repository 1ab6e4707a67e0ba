package com.example.vitals.web;

import com.example.vitals.errors.ApiException;
import com.example.vitals.model.ErrorResponse;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class ApiExceptionMapper implements ExceptionMapper<ApiException> {

    private static final Logger LOG = Logger.getLogger(ApiExceptionMapper.class);

    @Override
    public Response toResponse(ApiException e) {
        LOG.debugf("Request rejected with %s: %s", e.getErrorCode().code(), e.getMessage());
        return Response
            .status(e.getErrorCode().httpStatus())
            .type(MediaType.APPLICATION_JSON)
            .entity(ErrorResponse.of(e.getErrorCode().code(), e.getMessage(), e.getDetails()))
            .build();
    }
}
