package com.example.societyjobs.mapper;

import com.example.societyjobs.dto.JobDescriptorResponse;
import com.example.societyjobs.dto.JobRunResponse;
import com.example.societyjobs.service.handler.JobExecutionResult;
import com.example.societyjobs.service.registry.JobDescriptor;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting engine state to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    JobDescriptorResponse toResponse(JobDescriptor descriptor);

    List<JobDescriptorResponse> toResponseList(List<JobDescriptor> descriptors);

    /**
     * Convert the result of a manual run
     */
    JobRunResponse toRunResponse(JobExecutionResult result);
}
