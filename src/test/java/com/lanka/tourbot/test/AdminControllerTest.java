package com.lanka.tourbot.test;

import com.lanka.tourbot.adminapi.controller.AdminController;
import com.lanka.tourbot.repository.KnowledgeRepository;
import com.lanka.tourbot.service.KnowledgeBaseService;
import com.lanka.tourbot.service.SessionExpirySweeper;
import com.lanka.tourbot.service.SessionService;
import com.lanka.tourbot.service.impl.AdminLogServiceImpl;
import com.lanka.tourbot.service.impl.RuntimeConfigServiceImpl;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminController.class)
@Import({RuntimeConfigServiceImpl.class, AdminLogServiceImpl.class})
@TestPropertySource(properties = "admin.api-key=secret")
public class AdminControllerTest {

    private static final String KEY_HEADER = "X-Admin-Key";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private KnowledgeRepository knowledgeRepository;

    @MockBean
    private KnowledgeBaseService knowledgeBaseService;

    @MockBean
    private SessionExpirySweeper sessionExpirySweeper;

    @MockBean
    private SessionService sessionService;

    @Test
    public void requestWithoutKeyShouldBeRejected() throws Exception {
        mockMvc.perform(get("/api/admin/config"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Unauthorized"));

        mockMvc.perform(get("/api/admin/config").header(KEY_HEADER, "wrong"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    public void getConfigShouldReturnSnapshot() throws Exception {
        mockMvc.perform(get("/api/admin/config").header(KEY_HEADER, "secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.language.defaultLanguage").value("en"))
                .andExpect(jsonPath("$.data.intent.maxAlternatives").exists())
                .andExpect(jsonPath("$.data.personalization.GREETING").exists());
    }

    @Test
    public void updateConfigShouldApplyAndAudit() throws Exception {
        mockMvc.perform(put("/api/admin/config")
                        .header(KEY_HEADER, "secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"intent\":{\"maxAlternatives\":2},"
                                + "\"personalization\":{\"enthusiasm\":0,\"HELPFUL\":\"0.25\",\"nope\":1}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.intent.maxAlternatives").value(2))
                .andExpect(jsonPath("$.data.personalization.ENTHUSIASM").value(0.0))
                .andExpect(jsonPath("$.data.personalization.HELPFUL").value(0.25));

        mockMvc.perform(get("/api/admin/logs").header(KEY_HEADER, "secret").param("actionContains", "config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.data[0].action").value("config.update"));
    }

    @Test
    public void reindexShouldReloadThenIndex() throws Exception {
        when(knowledgeRepository.reload()).thenReturn(19);
        when(knowledgeBaseService.reindex()).thenReturn(19);
        when(knowledgeRepository.getSource()).thenReturn("classpath:data/knowledge_base.json");

        mockMvc.perform(post("/api/admin/knowledge/reindex").header(KEY_HEADER, "secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(19))
                .andExpect(jsonPath("$.source").value("classpath:data/knowledge_base.json"));

        verify(knowledgeRepository, times(1)).reload();
        verify(knowledgeBaseService, times(1)).reindex();
    }

    @Test
    public void sweepShouldReportRemovedSessions() throws Exception {
        when(sessionExpirySweeper.sweep()).thenReturn(2);
        when(sessionService.getActiveSessionCount()).thenReturn(5);

        mockMvc.perform(post("/api/admin/sessions/sweep").header(KEY_HEADER, "secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2))
                .andExpect(jsonPath("$.activeSessions").value(5));
    }
}
