package dev.resumetailor;

import dev.resumetailor.model.SelectionReport;
import dev.resumetailor.model.TailoringResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResumeTailorApplicationTests {

  @Mock
  private PipelineRunner pipelineRunner;

  @Mock
  private ExitManager exitManager;

  @Test
  void shouldRunPipelineAndExitSuccessfully() {
    ResumeTailorApplication app = new ResumeTailorApplication(pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenReturn(new TailoringResult(Map.of(), Map.of(), List.of(), Map.of(),
        new SelectionReport(Map.of(), List.of(), 0, 21, SelectionReport.LineBudgetStatus.UNDER), Map.of()));

    app.run();

    verify(pipelineRunner).execute();
    verify(exitManager).exit(0);
  }

  @Test
  void shouldHandleExceptionAndExitWithError() {
    ResumeTailorApplication app = new ResumeTailorApplication(pipelineRunner, exitManager);

    when(pipelineRunner.execute()).thenThrow(new IllegalStateException("Tailoring run failed"));

    app.run();

    verify(exitManager).exit(1);
    verify(exitManager, never()).exit(0);
  }
}
