package com.flagship.gate_ledger.gate;

import com.flagship.gate_ledger.exception.EntryNotFoundException;
import com.flagship.gate_ledger.exception.StoreUnavailableException;
import com.flagship.gate_ledger.identity.IdentityController;
import com.flagship.gate_ledger.identity.IdentityService;
import com.flagship.gate_ledger.ledger.LedgerEntryPersistenceService;
import com.flagship.gate_ledger.resolution.ResolutionController;
import com.flagship.gate_ledger.resolution.ResolutionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP status mapping of service failures, without a database.
 */
@WebMvcTest(controllers = {GateController.class, IdentityController.class, ResolutionController.class})
class GateControllerErrorMappingTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GateScanService gateScanService;

    @MockBean
    private CheckoutService checkoutService;

    @MockBean
    private LedgerEntryPersistenceService ledgerStore;

    @MockBean
    private IdentityService identityService;

    @MockBean
    private ResolutionService resolutionService;

    @Test
    @DisplayName("Blank regNo is a validation error")
    void scan_BlankRegNo_400() throws Exception {
        mockMvc.perform(post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"regNo\":\"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.regNo").exists());

        verifyNoInteractions(gateScanService);
    }

    @Test
    @DisplayName("Malformed body is a bad request")
    void scan_MalformedBody_400() throws Exception {
        mockMvc.perform(post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unreachable store maps to 503")
    void scan_StoreUnavailable_503() throws Exception {
        when(gateScanService.scan(anyString()))
            .thenThrow(new StoreUnavailableException("down", new RuntimeException("refused")));

        mockMvc.perform(post("/api/scans")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"regNo\":\"S101\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("Service Unavailable"));
    }

    @Test
    @DisplayName("Closing a missing entry is 404, an already closed one 409")
    void checkout_Errors() throws Exception {
        UUID missing = UUID.randomUUID();
        UUID closed = UUID.randomUUID();
        when(checkoutService.closeEntry(missing)).thenThrow(new EntryNotFoundException(missing));
        when(checkoutService.closeEntry(closed)).thenThrow(new IllegalStateException("already checked out"));

        mockMvc.perform(put("/api/entries/{id}/checkout", missing))
            .andExpect(status().isNotFound());
        mockMvc.perform(put("/api/entries/{id}/checkout", closed))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Constraint violation on registration is a conflict, not a server error")
    void register_ConstraintViolation_409() throws Exception {
        when(resolutionService.registerAndResolve(any()))
            .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        mockMvc.perform(post("/api/unknown-entries/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"regNo\":\"S101\",\"name\":\"A\",\"department\":\"CSE\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("Conflict"));
    }

    @Test
    @DisplayName("Registration with a blank name is rejected field by field")
    void register_MissingName_400() throws Exception {
        mockMvc.perform(post("/api/unknown-entries/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"regNo\":\"S101\",\"name\":\"\",\"department\":\"CSE\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.details.name").value("Name is required"));

        verifyNoInteractions(resolutionService);
    }

    @Test
    @DisplayName("Import with an invalid record is rejected as a whole")
    void import_InvalidRecord_400() throws Exception {
        mockMvc.perform(post("/api/identities/import")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"identities\":[{\"regNo\":\"A1\",\"name\":\"A\",\"department\":\"X\"},"
                        + "{\"regNo\":\"A2\",\"name\":\"B\"}]}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(identityService);
    }

    @Test
    @DisplayName("Unknown identity type on listing is a bad request")
    void listIdentities_BadType_400() throws Exception {
        mockMvc.perform(get("/api/identities").param("type", "ALIEN"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(identityService);
    }
}
