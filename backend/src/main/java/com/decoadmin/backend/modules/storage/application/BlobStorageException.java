package com.decoadmin.backend.modules.storage.application;

import com.decoadmin.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class BlobStorageException extends ProblemException {

    public static final String CODE = "storage.write_failed";

    public BlobStorageException(String detail, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, detail, cause);
    }
}
