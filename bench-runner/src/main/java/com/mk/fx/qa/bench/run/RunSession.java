package com.mk.fx.qa.bench.run;

import com.mk.fx.qa.bench.session.SessionLock;

/** One locked execution against an environment. */
public record RunSession(RunConfiguration configuration, SessionLock lock) {}
