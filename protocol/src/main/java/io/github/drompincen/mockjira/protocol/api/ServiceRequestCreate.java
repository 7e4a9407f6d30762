package io.github.drompincen.mockjira.protocol.api;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record ServiceRequestCreate(String serviceDeskId, String requestTypeId, ObjectNode requestFieldValues) {}
