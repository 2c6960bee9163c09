/**
 * Compiles validated flow documents into a pipecat-flows Python scaffold. {@link com.convoflow.codegen.FlowCompiler}
 * is the entry point and refuses invalid input; {@link com.convoflow.codegen.PythonFlowGenerator} is the template
 * expansion behind it.
 */
package com.convoflow.codegen;
