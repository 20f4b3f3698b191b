package com.aiide.backbone;

import com.aiide.backbone.test.TestServiceModule;
import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

@QuarkusTest
class DiagnosticResourceTest {

    @Test
    void ping_returnsOk() {
        given()
                .when().get("/api/diagnostic/ping")
                .then()
                .statusCode(200)
                .body("status", is("ok"))
                .body("message", is("Backbone is running"));
    }

    @Test
    void info_returnsAppMetadata() {
        given()
                .when().get("/api/diagnostic/info")
                .then()
                .statusCode(200)
                .body("name", is("backbone"))
                .body("version", notNullValue())
                .body("java", notNullValue())
                .body("profile", notNullValue())
                .body("lifecycle", is("RUNNING"));
    }

    @Test
    void services_reportsStatePerService() {
        given()
                .when().get("/api/diagnostic/services")
                .then()
                .statusCode(200)
                .body("'" + TestServiceModule.STORE + "'", is("READY"))
                .body("'" + TestServiceModule.ASSISTANT + "'", is("READY"))
                .body("'" + TestServiceModule.TELEMETRY + "'", is("FAILED"));
    }

    @Test
    void pools_listsRegisteredPools() {
        given()
                .when().get("/api/diagnostic/pools")
                .then()
                .statusCode(200)
                .body("name", hasItem(TestServiceModule.POOL))
                .body("maxSize", everyItem(greaterThan(0)));
    }

    @Test
    void tasks_listsActiveAndFinished() {
        given()
                .when().get("/api/diagnostic/tasks")
                .then()
                .statusCode(200)
                .body("active", notNullValue())
                .body("finished", notNullValue());
    }

    @Test
    void caches_returnsList() {
        given()
                .when().get("/api/diagnostic/caches")
                .then()
                .statusCode(200)
                .body("size()", greaterThanOrEqualTo(0));
    }

    @Test
    void reset_unknownServiceIs404() {
        given()
                .when().post("/api/diagnostic/services/no-such-service/reset")
                .then()
                .statusCode(404);
    }

    @Test
    void reset_readyServiceIsLeftAlone() {
        given()
                .when().post("/api/diagnostic/services/" + TestServiceModule.STORE + "/reset")
                .then()
                .statusCode(200)
                .body("reset", is(false))
                .body("state", is("READY"));
    }

    @Test
    void healthReady_returnsUp() {
        given()
                .when().get("/q/health/ready")
                .then()
                .statusCode(200)
                .body("status", is("UP"));
    }

    @Test
    void healthLive_returnsUp() {
        given()
                .when().get("/q/health/live")
                .then()
                .statusCode(200)
                .body("status", is("UP"));
    }
}
