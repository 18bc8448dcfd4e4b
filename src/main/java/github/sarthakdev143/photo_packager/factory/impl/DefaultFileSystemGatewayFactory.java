package github.sarthakdev143.photo_packager.factory.impl;

import github.sarthakdev143.photo_packager.factory.FileSystemGatewayFactory;
import github.sarthakdev143.photo_packager.integration.filesystem.GuardedFileSystemGateway;
import github.sarthakdev143.photo_packager.service.FileSystemGateway;
import org.springframework.stereotype.Component;

import java.util.function.Consumer;

@Component
public class DefaultFileSystemGatewayFactory implements FileSystemGatewayFactory {

    @Override
    public FileSystemGateway create(boolean dryRun, Consumer<String> dryRunListener) {
        return new GuardedFileSystemGateway(dryRun, dryRunListener);
    }
}
