package io.github.hotbrkm.campaignengine.server.web;

import io.github.hotbrkm.campaignengine.agent.email.content.RecipientProfile;
import io.github.hotbrkm.campaignengine.agent.email.content.SpintaxSyntaxException;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchAbortedException;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchResult;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.DispatchStatus;
import io.github.hotbrkm.campaignengine.agent.email.send.server.NoServerAvailableException;
import io.github.hotbrkm.campaignengine.server.campaign.CampaignDispatchService;
import io.github.hotbrkm.campaignengine.server.campaign.CampaignNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DispatchController.class)
@DisplayName("DispatchController test")
class DispatchControllerTest {

    private static final String BODY = """
            {"recipients":[
              {"subscriberId":7,"email":"jane@example.org","firstName":"Jane","company":"Acme",
               "timezone":"Asia/Seoul","industry":"technology"},
              {"subscriberId":8,"email":"not-an-address"}
            ]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CampaignDispatchService campaignDispatchService;

    @Test
    @DisplayName("Recipients are mapped to profiles and results returned per recipient")
    @SuppressWarnings("unchecked")
    void dispatch_returnsResults() throws Exception {
        when(campaignDispatchService.dispatch(eq(3L), anyList())).thenReturn(List.of(
                new DispatchResult(7L, "jane@example.org", DispatchStatus.SENT, "ab".repeat(32), null),
                new DispatchResult(8L, "not-an-address", DispatchStatus.REJECTED, null, "Invalid email address")));

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].recipientId").value(7))
                .andExpect(jsonPath("$[0].status").value("SENT"))
                .andExpect(jsonPath("$[0].trackingId").value("ab".repeat(32)))
                .andExpect(jsonPath("$[1].status").value("REJECTED"))
                .andExpect(jsonPath("$[1].error").value("Invalid email address"));

        ArgumentCaptor<List<RecipientProfile>> recipients = ArgumentCaptor.forClass(List.class);
        verify(campaignDispatchService).dispatch(eq(3L), recipients.capture());
        assertThat(recipients.getValue()).hasSize(2);
        RecipientProfile jane = recipients.getValue().get(0);
        assertThat(jane.subscriberId()).isEqualTo(7L);
        assertThat(jane.firstName()).isEqualTo("Jane");
        assertThat(jane.timezone()).isEqualTo("Asia/Seoul");
        assertThat(jane.industry()).isEqualTo("technology");
    }

    @Test
    @DisplayName("Empty recipient list or blank email is a 400")
    void dispatch_validation() throws Exception {
        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipients\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipients\":[{\"email\":\" \"}]}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(campaignDispatchService);
    }

    @Test
    @DisplayName("Malformed spintax is a 400 listing every error")
    void dispatch_spintaxError() throws Exception {
        when(campaignDispatchService.dispatch(anyLong(), anyList()))
                .thenThrow(new SpintaxSyntaxException(List.of("Unclosed '{' at 4", "Empty option at 9")));

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.length()").value(2))
                .andExpect(jsonPath("$.path").value("/api/campaigns/3/dispatch"));
    }

    @Test
    @DisplayName("Unknown campaign is a 404")
    void dispatch_unknownCampaign() throws Exception {
        when(campaignDispatchService.dispatch(anyLong(), anyList())).thenThrow(new CampaignNotFoundException(99L));

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 99).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Campaign not found: 99"));
    }

    @Test
    @DisplayName("Empty server pool is a 503")
    void dispatch_noServer() throws Exception {
        when(campaignDispatchService.dispatch(anyLong(), anyList()))
                .thenThrow(new NoServerAvailableException("No enabled SMTP server"));

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.results").doesNotExist());
    }

    @Test
    @DisplayName("Pool running dry mid-batch is a 503 carrying the outcomes so far")
    void dispatch_abortedMidBatch() throws Exception {
        List<DispatchResult> partial = List.of(
                new DispatchResult(1L, "a@example.org", DispatchStatus.SENT, "t".repeat(64), null),
                new DispatchResult(2L, "b@example.org", DispatchStatus.FAILED, "u".repeat(64), "No enabled SMTP server"));
        when(campaignDispatchService.dispatch(anyLong(), anyList()))
                .thenThrow(new DispatchAbortedException("No enabled SMTP server", partial, null));

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 3).contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.results.length()").value(2))
                .andExpect(jsonPath("$.results[0].status").value("SENT"))
                .andExpect(jsonPath("$.results[1].status").value("FAILED"))
                .andExpect(jsonPath("$.results[1].email").value("b@example.org"));
    }
}
