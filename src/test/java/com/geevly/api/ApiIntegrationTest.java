package com.geevly.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ApiIntegrationTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper mapper;

    private JsonNode createSchool(String name) throws Exception {
        MvcResult result = mvc.perform(post("/api/v1/schools")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"" + name + "\",\"principal\":\"Ms. Aquino\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.version").value(1))
            .andReturn();
        return mapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("created school is readable with snake_case fields and its history")
    void createAndRead() throws Exception {
        String name = "Api School " + UUID.randomUUID();
        String id = createSchool(name).get("id").asText();

        mvc.perform(get("/api/v1/schools/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value(name))
            .andExpect(jsonPath("$.active").value(true));

        mvc.perform(get("/api/v1/schools/{id}/history", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].type").value("CreateSchool"))
            .andExpect(jsonPath("$[0].aggregate_id").value(id))
            .andExpect(jsonPath("$[0].payload.name").value(name));

        mvc.perform(get("/api/v1/events").param("stream", "school").param("aggregate_id", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    @DisplayName("unknown aggregate is a 404 with the error body")
    void notFound() throws Exception {
        mvc.perform(get("/api/v1/students/{id}", "missing-" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"))
            .andExpect(jsonPath("$.message").exists())
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("stale expected version is a 409")
    void versionConflict() throws Exception {
        String id = createSchool("Api Conflict " + UUID.randomUUID()).get("id").asText();

        mvc.perform(post("/api/v1/schools/{id}/active", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expected_version\":1,\"active\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value(2));

        mvc.perform(post("/api/v1/schools/{id}/active", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expected_version\":1,\"active\":true}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("VERSION_CONFLICT"));
    }

    @Test
    @DisplayName("invalid command is a 400")
    void validationFailure() throws Exception {
        mvc.perform(post("/api/v1/schools")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));

        mvc.perform(post("/api/v1/students")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"first_name\":\"A\",\"last_name\":\"B\",\"date_of_birth\":\"not-a-date\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("uploaded file content is served back")
    void fileUpload() throws Exception {
        byte[] bytes = "lrn,grade\n1,90\n".getBytes(StandardCharsets.UTF_8);
        MvcResult result = mvc.perform(multipart("/api/v1/files")
                .file(new MockMultipartFile("file", "grades.csv", "text/csv", bytes))
                .param("domain_reference", "bulk_upload"))
            .andExpect(status().isCreated())
            .andReturn();
        String id = mapper.readTree(result.getResponse().getContentAsString()).get("id").asText();

        mvc.perform(get("/api/v1/files/{id}/content", id))
            .andExpect(status().isOk())
            .andExpect(content().bytes(bytes));
    }

    @Test
    @DisplayName("unknown stream cannot be rebuilt")
    void rebuildUnknownStream() throws Exception {
        mvc.perform(post("/api/v1/admin/projections/{stream}/rebuild", "nope"))
            .andExpect(status().isNotFound());
        mvc.perform(post("/api/v1/admin/projections/{stream}/rebuild", "school"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.stream").value("school"));
    }

    @Test
    @DisplayName("build info reports the configured stamp")
    void buildInfo() throws Exception {
        mvc.perform(get("/api/v1/build-info"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.version").value("test"))
            .andExpect(jsonPath("$.commit").value("0000000"));
    }
}
