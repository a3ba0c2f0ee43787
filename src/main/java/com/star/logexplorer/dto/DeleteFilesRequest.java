package com.star.logexplorer.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DeleteFilesRequest {

    @NotEmpty(message = "No files specified for deletion")
    private List<String> files;
}
