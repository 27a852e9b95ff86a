package com.dnobretech.contentalignerbackend.exception;

record FieldErr(String field, String message) {}
