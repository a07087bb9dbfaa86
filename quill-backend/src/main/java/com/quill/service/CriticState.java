package com.quill.service;

/**
 * States of the self-correcting executor.
 */
public enum CriticState {
    ATTEMPTING,
    SUCCEEDED,
    EXHAUSTED
}
