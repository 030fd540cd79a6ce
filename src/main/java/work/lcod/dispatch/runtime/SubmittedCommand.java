package work.lcod.dispatch.runtime;

import work.lcod.dispatch.api.ResultCallback;

record SubmittedCommand(String rawInput, CommandContext context, ResultCallback callback) {}
