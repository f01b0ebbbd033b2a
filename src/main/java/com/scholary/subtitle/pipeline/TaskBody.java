package com.scholary.subtitle.pipeline;

/** The work a {@link PipelineTask} runs. */
@FunctionalInterface
public interface TaskBody<T> {

  T run(TaskContext context) throws Exception;
}
