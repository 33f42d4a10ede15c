package com.vidnyan.rpax.application.port.out;

import com.vidnyan.rpax.domain.model.ProjectDescriptor;

import java.nio.file.Path;

/**
 * Port for reading the project declaration of a project directory.
 */
public interface ProjectDescriptorReader {

    /**
     * Read {@code project.json} from the project root.
     * @throws ProjectDescriptorException when the file is missing or invalid
     */
    ProjectDescriptor read(Path projectRoot);

    /**
     * The project declaration could not be read; the project cannot be analyzed.
     */
    class ProjectDescriptorException extends RuntimeException {

        public ProjectDescriptorException(String message) {
            super(message);
        }

        public ProjectDescriptorException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
