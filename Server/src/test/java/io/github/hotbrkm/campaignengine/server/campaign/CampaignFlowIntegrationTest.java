package io.github.hotbrkm.campaignengine.server.campaign;

import io.github.hotbrkm.campaignengine.agent.email.mime.ComposedMessage;
import io.github.hotbrkm.campaignengine.agent.email.send.engine.Sleeper;
import io.github.hotbrkm.campaignengine.agent.email.send.result.SendStatus;
import io.github.hotbrkm.campaignengine.agent.email.send.server.SmtpServer;
import io.github.hotbrkm.campaignengine.agent.email.send.transport.MailTransport;
import io.github.hotbrkm.campaignengine.agent.email.send.transport.TransportException;
import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignAttachment;
import io.github.hotbrkm.campaignengine.server.persistence.entity.CampaignEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.LinkMappingEntity;
import io.github.hotbrkm.campaignengine.server.persistence.entity.SendRecordEntity;
import io.github.hotbrkm.campaignengine.server.persistence.repository.CampaignRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.ClickEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.ConversionEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.LinkMappingRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.OpenEventRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SendRecordRepository;
import io.github.hotbrkm.campaignengine.server.persistence.repository.SubscriberEngagementRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Campaign dispatch and attribution flow test")
class CampaignFlowIntegrationTest {

    private static final String CHECKOUT_URL = "https://shop.example.com/checkout";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private CampaignRepository campaignRepository;
    @Autowired
    private SendRecordRepository sendRecordRepository;
    @Autowired
    private LinkMappingRepository linkMappingRepository;
    @Autowired
    private OpenEventRepository openEventRepository;
    @Autowired
    private ClickEventRepository clickEventRepository;
    @Autowired
    private ConversionEventRepository conversionEventRepository;
    @Autowired
    private SubscriberEngagementRepository subscriberEngagementRepository;

    @MockBean
    private MailTransport mailTransport;
    @MockBean
    private Sleeper sleeper;

    @AfterEach
    void tearDown() {
        conversionEventRepository.deleteAll();
        clickEventRepository.deleteAll();
        openEventRepository.deleteAll();
        linkMappingRepository.deleteAll();
        sendRecordRepository.deleteAll();
        subscriberEngagementRepository.deleteAll();
        campaignRepository.deleteAll();
    }

    @Test
    @DisplayName("Dispatched message is tracked from open through click to conversion")
    void dispatchOpenClickConvert() throws Exception {
        long campaignId = saveCampaign();

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", campaignId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"recipients":[
                                  {"subscriberId":7,"email":"jane@example.org","firstName":"Jane"},
                                  {"subscriberId":8,"email":"broken@"}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("SENT"))
                .andExpect(jsonPath("$[1].status").value("REJECTED"));

        ArgumentCaptor<ComposedMessage> message = ArgumentCaptor.forClass(ComposedMessage.class);
        verify(mailTransport).send(any(SmtpServer.class), message.capture());
        assertThat(message.getValue().recipient()).isEqualTo("jane@example.org");
        assertThat(message.getValue().rawMime())
                .contains("Subject: Hello Jane")
                .contains("List-Unsubscribe: <https://track.example.com/unsubscribe/");

        SendRecordEntity send = sendRecordRepository.findAll().get(0);
        assertThat(send.getStatus()).isEqualTo(SendStatus.SENT);
        assertThat(send.getSentAt()).isNotNull();
        List<LinkMappingEntity> links = linkMappingRepository.findByTrackingIdOrderByPositionAsc(send.getTrackingId());
        assertThat(links).extracting(LinkMappingEntity::getOriginalUrl).containsExactly(CHECKOUT_URL);

        mockMvc.perform(get("/track/pixel/{token}", send.getTrackingId()).header("X-Forwarded-For", "203.0.113.9"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/track/click/{linkId}", links.get(0).getLinkId()).header("X-Forwarded-For", "203.0.113.9"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", CHECKOUT_URL));
        mockMvc.perform(get("/track/click/{linkId}", links.get(0).getLinkId()).header("X-Forwarded-For", "203.0.113.9"))
                .andExpect(status().isFound());

        mockMvc.perform(get("/api/campaigns/{id}/analytics", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.counters.emailsSent").value(1))
                .andExpect(jsonPath("$.counters.emailsOpened").value(1))
                .andExpect(jsonPath("$.counters.uniqueOpens").value(1))
                .andExpect(jsonPath("$.counters.clicks").value(2))
                .andExpect(jsonPath("$.counters.uniqueClicks").value(1))
                .andExpect(jsonPath("$.counters.conversions").value(1))
                .andExpect(jsonPath("$.rates.openRate").value(100.0))
                .andExpect(jsonPath("$.rates.conversionRate").value(100.0))
                .andExpect(jsonPath("$.devices[0].percentage").value(100.0))
                .andExpect(jsonPath("$.topLinks[0].url").value(CHECKOUT_URL))
                .andExpect(jsonPath("$.topLinks[0].clicks").value(2))
                .andExpect(jsonPath("$.topLinks[0].uniqueClicks").value(1));

        assertThat(subscriberEngagementRepository.findById(7L).orElseThrow().getEngagementScore()).isEqualTo(12);
    }

    // Server health is shared across the context, the failover order needs a fresh pool
    @Test
    @DirtiesContext(methodMode = DirtiesContext.MethodMode.BEFORE_METHOD)
    @DisplayName("Primary relay failure fails over to the secondary")
    void dispatchFailsOver() throws Exception {
        long campaignId = saveCampaign();
        doThrow(new TransportException("primary", 421, "Service not available", null))
                .when(mailTransport).send(argThat(server -> "primary".equals(server.name())), any());

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", campaignId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipients\":[{\"subscriberId\":7,\"email\":\"jane@example.org\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("SENT"));

        verify(mailTransport, times(2)).send(any(), any());
        SendRecordEntity send = sendRecordRepository.findAll().get(0);
        assertThat(send.getSmtpServer()).isEqualTo("secondary");
        assertThat(send.getRetryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Campaign attachments are sent and the open shows in realtime and delivery analytics")
    void dispatchWithAttachmentAndReport(@TempDir Path tempDir) throws Exception {
        Path brochure = tempDir.resolve("brochure.pdf");
        Files.writeString(brochure, "%PDF-1.4");
        CampaignEntity campaign = campaignRepository.findById(saveCampaign()).orElseThrow();
        campaign.getAttachments().add(new CampaignAttachment("Spring brochure.pdf", brochure.toString()));
        long campaignId = campaignRepository.save(campaign).getId();

        mockMvc.perform(post("/api/campaigns/{id}/dispatch", campaignId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipients\":[{\"subscriberId\":7,\"email\":\"jane@example.org\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("SENT"));

        ArgumentCaptor<ComposedMessage> message = ArgumentCaptor.forClass(ComposedMessage.class);
        verify(mailTransport).send(any(SmtpServer.class), message.capture());
        assertThat(message.getValue().rawMime())
                .contains("Content-Type: multipart/mixed")
                .contains("Content-Disposition: attachment");

        SendRecordEntity send = sendRecordRepository.findAll().get(0);
        mockMvc.perform(get("/track/pixel/{token}", send.getTrackingId()).header("X-Forwarded-For", "203.0.113.9"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/campaigns/{id}/realtime", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.opens[0].email").value("jane@example.org"))
                .andExpect(jsonPath("$.clicks").isEmpty());
        mockMvc.perform(get("/api/delivery/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalSent").value(1))
                .andExpect(jsonPath("$.successRate").value(100.0))
                .andExpect(jsonPath("$.domainAnalytics[0].domain").value("example.org"))
                .andExpect(jsonPath("$.serverPerformance[0].name").value("primary"));
    }

    @Test
    @DisplayName("Unknown campaign answers 404 without sending")
    void dispatchUnknownCampaign() throws Exception {
        mockMvc.perform(post("/api/campaigns/{id}/dispatch", 4040)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipients\":[{\"email\":\"jane@example.org\"}]}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/campaigns/{id}/analytics", 4040))
                .andExpect(status().isNotFound());
        mockMvc.perform(get("/api/campaigns/{id}/realtime", 4040))
                .andExpect(status().isNotFound());
    }

    private long saveCampaign() {
        return campaignRepository.save(CampaignEntity.builder()
                .name("Spring launch")
                .subject("Hello {{first_name}}")
                .htmlContent("<p>Hi {{first_name}}</p><a href=\"" + CHECKOUT_URL + "\">Buy</a>"
                        + "<a href=\"mailto:help@example.com\">Help</a>")
                .textContent("Hi {{first_name}}")
                .build()).getId();
    }
}
