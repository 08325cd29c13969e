package com.flamingo.ai.docpipeline.api.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.docpipeline.domain.enums.DocumentStatus;
import com.flamingo.ai.docpipeline.service.document.DocumentStateStore;
import com.flamingo.ai.docpipeline.storage.StorageBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private DocumentStateStore stateStore;
  @Mock private StorageBackend storageBackend;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new HealthController(stateStore, storageBackend)).build();
  }

  @Test
  void shouldReportUpWithStorageBackend() throws Exception {
    when(storageBackend.name()).thenReturn("local");

    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"))
        .andExpect(jsonPath("$.storage").value("local"));
  }

  @Test
  void shouldCountDocumentsPerStatus() throws Exception {
    when(stateStore.countActive()).thenReturn(3L);
    when(stateStore.countByStatus(any(DocumentStatus.class))).thenReturn(0L);
    when(stateStore.countByStatus(DocumentStatus.PROCESSED)).thenReturn(2L);
    when(stateStore.countByStatus(DocumentStatus.FAILED)).thenReturn(1L);

    mockMvc
        .perform(get("/api/health/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalDocuments").value(3))
        .andExpect(jsonPath("$.documentsByStatus.PROCESSED").value(2))
        .andExpect(jsonPath("$.documentsByStatus.FAILED").value(1))
        .andExpect(jsonPath("$.documentsByStatus.PENDING").value(0));
  }
}
