package com.scholary.vocab.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.vocab.pipeline.PipelineRun;
import com.scholary.vocab.pipeline.RunRequest;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class JobRepositoryTest {

  private final JobRepository repository = new JobRepository(10, 60);

  @Test
  void save_shouldMakeRunFindableById() {
    PipelineRun run = run("run-1");

    repository.save(run);

    assertThat(repository.findById("run-1")).containsSame(run);
    assertThat(repository.findById("run-2")).isEmpty();
  }

  @Test
  void delete_shouldForgetRun() {
    repository.save(run("run-1"));

    repository.delete("run-1");

    assertThat(repository.findById("run-1")).isEmpty();
  }

  private static PipelineRun run(String id) {
    return new PipelineRun(id, new RunRequest(Path.of("in.txt"), Path.of("out.csv")));
  }
}
