package socialauth.saml.exception;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import socialauth.saml.controller.SamlAuthController;
import socialauth.saml.service.SamlAuthService;

class GlobalExceptionHandlerTest {

    private SamlAuthService samlAuthService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        samlAuthService = mock(SamlAuthService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new SamlAuthController(samlAuthService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("Should hide configuration errors behind a generic message")
    void shouldHandleInvalidConfiguration() throws Exception {
        when(samlAuthService.generateMetadataXml())
            .thenThrow(new InvalidSamlConfigurationException("Unable to build SAML settings for IdP 'dummy': bad cert"));

        mockMvc.perform(get("/auth/saml/metadata"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.message").value("SAML service provider is misconfigured"));
    }

    @Test
    @DisplayName("Should map illegal arguments to 400")
    void shouldHandleIllegalArgument() throws Exception {
        when(samlAuthService.generateMetadataXml()).thenThrow(new IllegalArgumentException("bad input"));

        mockMvc.perform(get("/auth/saml/metadata"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("bad input"));
    }

    @Test
    @DisplayName("Should not leak unexpected error details")
    void shouldHandleGenericException() throws Exception {
        when(samlAuthService.generateMetadataXml()).thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(get("/auth/saml/metadata"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
    }
}
