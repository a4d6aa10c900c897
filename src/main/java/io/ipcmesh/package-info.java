/**
 * ipcmesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ipcmesh.Main} bootstraps the CLI process, including the worker side.</li>
 *   <li>{@code io.ipcmesh.cli.IpcMeshCommand} maps commands to the bus and the supervisor.</li>
 *   <li>{@code io.ipcmesh.bus.EventBus} is the in-process publish/subscribe registry.</li>
 *   <li>{@code io.ipcmesh.process.ManagedProcess} supervises one worker and correlates requests with responses.</li>
 * </ul>
 */
package io.ipcmesh;
