package com.ospicorp.anomalyapi.cache;

import com.ospicorp.anomalyapi.model.ModelParameters;

public record CacheLookup(ModelParameters parameters, boolean hit) {

  static CacheLookup hit(ModelParameters parameters) {
    return new CacheLookup(parameters, true);
  }

  static CacheLookup miss(ModelParameters parameters) {
    return new CacheLookup(parameters, false);
  }
}
