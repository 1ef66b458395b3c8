package com.example.authclient.domain.entity;

/**
 * Lifecycle of the interactive authorization flow.
 */
public enum FlowState {
  IDLE,
  AWAITING_CALLBACK,
  SUCCEEDED,
  CANCELLED,
  FAILED
}
