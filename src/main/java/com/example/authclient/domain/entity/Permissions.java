package com.example.authclient.domain.entity;

import java.util.List;

public record Permissions(Organization organization, List<String> permissions) {

  public Permissions {
    permissions = List.copyOf(permissions);
  }
}
