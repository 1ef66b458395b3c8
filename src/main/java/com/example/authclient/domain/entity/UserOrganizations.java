package com.example.authclient.domain.entity;

import java.util.List;

public record UserOrganizations(List<Organization> orgCodes) {

  public UserOrganizations {
    orgCodes = List.copyOf(orgCodes);
  }
}
