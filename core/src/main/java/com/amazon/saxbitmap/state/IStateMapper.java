/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.saxbitmap.state;

/**
 * A mapper converts a model into a plain state object that can be serialized,
 * and back.
 *
 * @param <Model> the model type
 * @param <State> the state type
 */
public interface IStateMapper<Model, State> {

    /**
     * Create a state object that captures everything needed to recreate the
     * model.
     *
     * @param model the model
     * @return a state object
     */
    State toState(Model model);

    /**
     * Create a model from the given state. A model created this way behaves
     * exactly as the model the state was taken from.
     *
     * @param state a state object
     * @return the model
     */
    Model toModel(State state);
}
