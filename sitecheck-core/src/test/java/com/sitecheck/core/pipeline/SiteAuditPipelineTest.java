package com.sitecheck.core.pipeline;

import com.sitecheck.data.repository.AuditRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SiteAuditPipelineTest {

    @Mock
    private AuditRepository auditRepository;

    @Mock
    private PageFetcher pageFetcher;

    @Mock
    private PageAnalyzer pageAnalyzer;

    @Mock
    private ReportRenderer reportRenderer;

    @InjectMocks
    private SiteAuditPipeline pipeline;

    @Test
    void fetchesNormalizedUrlAndRendersReport() {
        UUID auditId = UUID.randomUUID();
        FetchedPage page = FetchedPage.builder().url("https://example.com").body("<html/>").build();
        PageAnalysis analysis = PageAnalysis.builder().score(90).issues(List.of()).build();
        AuditReport report = AuditReport.builder().html("<html>report</html>").overallScore(90).issues(List.of()).build();

        when(auditRepository.findUrl(auditId)).thenReturn(Optional.of(" Example.com "));
        when(pageFetcher.fetch("https://example.com")).thenReturn(page);
        when(pageAnalyzer.analyze(page)).thenReturn(analysis);
        when(reportRenderer.render(analysis)).thenReturn(report);

        assertThat(pipeline.runAudit(auditId)).isSameAs(report);
        verify(pageFetcher).fetch("https://example.com");
    }

    @Test
    void unknownAuditFails() {
        UUID auditId = UUID.randomUUID();
        when(auditRepository.findUrl(any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> pipeline.runAudit(auditId))
            .isInstanceOf(AuditPipelineException.class)
            .hasMessageContaining(auditId.toString());
        verifyNoInteractions(pageFetcher);
    }
}
