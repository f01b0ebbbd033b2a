package com.scholary.subtitle.job;

import com.scholary.subtitle.pipeline.PipelineFactory;
import com.scholary.subtitle.pipeline.PipelineTask;
import com.scholary.subtitle.pipeline.SubtitleSource;
import com.scholary.subtitle.pipeline.SynthesisReport;
import com.scholary.subtitle.pipeline.TaskBody;
import com.scholary.subtitle.pipeline.TranscriptionPipeline;
import com.scholary.subtitle.pipeline.TranscriptionResult;
import com.scholary.subtitle.pipeline.VoiceGenerationPipeline;
import com.scholary.subtitle.synthesis.VoiceSelector;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Submits pipelines as jobs on the bounded task executor.
 *
 * <p>Each submission builds a fresh pipeline, wraps it in a {@link PipelineTask} whose listener is
 * the stored {@link PipelineJob}, and starts it.
 */
@Service
public class JobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);

  private final PipelineFactory pipelineFactory;
  private final JobRepository jobRepository;
  private final Executor taskExecutor;

  public JobService(
      PipelineFactory pipelineFactory,
      JobRepository jobRepository,
      @Qualifier("taskExecutor") Executor taskExecutor) {
    this.pipelineFactory = pipelineFactory;
    this.jobRepository = jobRepository;
    this.taskExecutor = taskExecutor;
  }

  public PipelineJob<TranscriptionResult> submitTranscription(
      String mediaLocation, String subtitleDestination, String targetLanguage) {
    TranscriptionPipeline pipeline =
        pipelineFactory.transcription(mediaLocation, subtitleDestination, targetLanguage);
    return submit(TranscriptionPipeline.NAME, pipeline);
  }

  public PipelineJob<SynthesisReport> submitVoice(
      SubtitleSource source, String audioDestination, String targetLanguage, VoiceSelector voice) {
    VoiceGenerationPipeline pipeline =
        pipelineFactory.voice(source, audioDestination, targetLanguage, voice);
    return submit(VoiceGenerationPipeline.NAME, pipeline);
  }

  public Optional<PipelineJob<?>> find(String jobId) {
    return jobRepository.findById(jobId);
  }

  /**
   * Request cancellation of a job.
   *
   * @return false if the job is unknown or expired
   */
  public boolean cancel(String jobId) {
    Optional<PipelineJob<?>> job = jobRepository.findById(jobId);
    job.ifPresent(
        j -> {
          LOGGER.info("Cancelling job: {}", jobId);
          j.cancel();
        });
    return job.isPresent();
  }

  private <T> PipelineJob<T> submit(String pipelineName, TaskBody<T> pipeline) {
    String jobId = UUID.randomUUID().toString();
    PipelineJob<T> job = new PipelineJob<>(jobId, pipelineName);

    TaskBody<T> body =
        context -> {
          job.markRunning();
          return pipeline.run(context);
        };
    PipelineTask<T> task = new PipelineTask<>(jobId, pipelineName, body, job);
    job.attach(task);
    jobRepository.save(job);

    LOGGER.info("Created async {} job: {}", pipelineName, jobId);
    task.start(taskExecutor);
    return job;
  }
}
