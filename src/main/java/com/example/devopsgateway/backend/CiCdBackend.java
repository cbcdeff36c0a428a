package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.Deployment;

public interface CiCdBackend {

    Deployment deploy(String serviceName, String version, String environment);
}
