package com.dnobretech.contentalignerbackend.exception;

import java.time.Instant;
import java.util.List;

record ValidationError(int status, String error, String category, List<FieldErr> errors, String path, Instant timestamp) {}
