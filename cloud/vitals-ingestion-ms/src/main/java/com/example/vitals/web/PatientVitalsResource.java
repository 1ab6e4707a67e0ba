package com.example.vitals.web;

import com.example.vitals.model.IngestionOut;
import com.example.vitals.model.VitalHistoryPage;
import com.example.vitals.model.VitalReading;
import com.example.vitals.processing.IngestionPipeline;
import com.example.vitals.processing.IngestionResult;
import com.example.vitals.processing.VitalQueries;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/api/v1/patients/{patientId}")
@Produces(MediaType.APPLICATION_JSON)
public class PatientVitalsResource {

    private final IngestionPipeline ingestionPipeline;
    private final VitalQueries vitalQueries;

    public PatientVitalsResource(IngestionPipeline ingestionPipeline, VitalQueries vitalQueries) {
        this.ingestionPipeline = ingestionPipeline;
        this.vitalQueries = vitalQueries;
    }

    // body is taken raw so authorization runs before any payload parsing
    @POST
    @Path("/vitals")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response postVitals(
        @PathParam("patientId") String patientId,
        @HeaderParam(Headers.API_KEY) String apiKey,
        @HeaderParam(Headers.IDEMPOTENCY_KEY) String idempotencyKey,
        String body
    ) {
        IngestionResult result = ingestionPipeline.ingest(patientId, body, apiKey, idempotencyKey);

        IngestionOut out = new IngestionOut();
        out.vitalId = result.vitalId();
        out.status = result.status();
        Response.Status status = result.isStored()
            ? Response.Status.CREATED
            : Response.Status.OK;
        return Response.status(status).entity(out).build();
    }

    @GET
    @Path("/latest")
    public VitalReading latest(@PathParam("patientId") String patientId) {
        return vitalQueries.latest(patientId);
    }

    @GET
    @Path("/history")
    public VitalHistoryPage history(
        @PathParam("patientId") String patientId,
        @QueryParam("from") String from,
        @QueryParam("to") String to,
        @QueryParam("page") String page,
        @QueryParam("page_size") String pageSize
    ) {
        return vitalQueries.history(patientId, from, to, page, pageSize);
    }
}
