package com.github.dimitryivaniuta.scoped.core.endpoint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EndpointOperationTest {

    @Test
    void standardOperationsMapToTheirBucket() {
        assertEquals("read", EndpointOperation.named("list").action());
        assertEquals("read", EndpointOperation.named("retrieve").action());
        assertEquals("write", EndpointOperation.named("create").action());
        assertEquals("write", EndpointOperation.named("update").action());
        assertEquals("write", EndpointOperation.named("partial_update").action());
        assertEquals("delete", EndpointOperation.named("destroy").action());
    }

    @Test
    void customOperationsUseTheirOwnName() {
        EndpointOperation publish = EndpointOperation.named("publish");

        assertEquals(OperationKind.CUSTOM, publish.kind());
        assertEquals("publish", publish.action());
    }

    @Test
    void httpMethodFallback() {
        assertEquals("read", EndpointOperation.forHttpMethod("GET").action());
        assertEquals("read", EndpointOperation.forHttpMethod("head").action());
        assertEquals("read", EndpointOperation.forHttpMethod("OPTIONS").action());
        assertEquals("write", EndpointOperation.forHttpMethod("POST").action());
        assertEquals("write", EndpointOperation.forHttpMethod("PUT").action());
        assertEquals("write", EndpointOperation.forHttpMethod("PATCH").action());
        assertEquals("delete", EndpointOperation.forHttpMethod("DELETE").action());
        assertEquals("read", EndpointOperation.forHttpMethod("TRACE").action());
    }

    @Test
    void blankNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> EndpointOperation.custom(" "));
    }
}
