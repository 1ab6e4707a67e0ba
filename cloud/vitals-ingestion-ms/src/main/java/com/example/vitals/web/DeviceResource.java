package com.example.vitals.web;

import com.example.vitals.model.DeviceRegistrationIn;
import com.example.vitals.model.DeviceRegistrationOut;
import com.example.vitals.processing.CredentialStore;
import com.example.vitals.processing.DeviceRegistry;
import com.example.vitals.processing.PayloadReader;
import com.example.vitals.processing.Registration;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

@Path("/api/v1/devices")
@Produces(MediaType.APPLICATION_JSON)
public class DeviceResource {

    private final CredentialStore credentialStore;
    private final PayloadReader payloadReader;
    private final DeviceRegistry deviceRegistry;

    public DeviceResource(
        CredentialStore credentialStore,
        PayloadReader payloadReader,
        DeviceRegistry deviceRegistry
    ) {
        this.credentialStore = credentialStore;
        this.payloadReader = payloadReader;
        this.deviceRegistry = deviceRegistry;
    }

    @POST
    @Path("/register")
    @Consumes(MediaType.APPLICATION_JSON)
    public Response register(@HeaderParam(Headers.API_KEY) String apiKey, String body) {
        credentialStore.requireAuthorized(apiKey);
        DeviceRegistrationIn in = payloadReader.read(body, DeviceRegistrationIn.class);

        Registration registration = deviceRegistry.register(in.deviceId, in.type, in.patientId);

        DeviceRegistrationOut out = new DeviceRegistrationOut();
        out.deviceId = registration.deviceId();
        out.apiKey = registration.apiKey();
        out.status = registration.status();
        Response.Status status = registration.alreadyExisted()
            ? Response.Status.OK
            : Response.Status.CREATED;
        return Response.status(status).entity(out).build();
    }
}
