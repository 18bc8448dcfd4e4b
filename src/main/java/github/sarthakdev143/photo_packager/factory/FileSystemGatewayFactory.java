package github.sarthakdev143.photo_packager.factory;

import github.sarthakdev143.photo_packager.service.FileSystemGateway;

import java.util.function.Consumer;

public interface FileSystemGatewayFactory {

    FileSystemGateway create(boolean dryRun, Consumer<String> dryRunListener);
}
